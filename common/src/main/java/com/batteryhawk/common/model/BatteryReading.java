/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * One battery measurement as decoded from a monitor device.
 * Voltage in volts, current in amperes, temperature in Celsius, state of charge in percent,
 * capacity in mAh.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatteryReading {

    @JsonProperty("voltage")
    private Double voltage;

    @JsonProperty("current")
    private Double current;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("state_of_charge")
    private Double stateOfCharge;

    @JsonProperty("capacity")
    private Double capacity;

    @JsonProperty("cycles")
    private Integer cycles;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("extra")
    private Map<String, Object> extra;

    public BatteryReading() {}

    public BatteryReading(Double voltage, Double current, Double temperature, Double stateOfCharge) {
        this.voltage = voltage;
        this.current = current;
        this.temperature = temperature;
        this.stateOfCharge = stateOfCharge;
    }

    /** Instantaneous power in watts, or {@code null} unless both voltage and current are known. */
    public Double power() {
        if (voltage == null || current == null) return null;
        return voltage * current;
    }

    public Double getVoltage() { return voltage; }
    public void setVoltage(Double voltage) { this.voltage = voltage; }
    public Double getCurrent() { return current; }
    public void setCurrent(Double current) { this.current = current; }
    public Double getTemperature() { return temperature; }
    public void setTemperature(Double temperature) { this.temperature = temperature; }
    public Double getStateOfCharge() { return stateOfCharge; }
    public void setStateOfCharge(Double stateOfCharge) { this.stateOfCharge = stateOfCharge; }
    public Double getCapacity() { return capacity; }
    public void setCapacity(Double capacity) { this.capacity = capacity; }
    public Integer getCycles() { return cycles; }
    public void setCycles(Integer cycles) { this.cycles = cycles; }
    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
    public Map<String, Object> getExtra() { return extra; }
    public void setExtra(Map<String, Object> extra) { this.extra = extra; }
}
