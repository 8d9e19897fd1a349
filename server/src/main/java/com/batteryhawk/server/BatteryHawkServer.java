/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.server;

import com.batteryhawk.messaging.core.ResilientMqttClient;
import com.batteryhawk.messaging.paho.PahoBrokerTransport;
import com.batteryhawk.server.config.ConfigManager;
import com.batteryhawk.server.mqtt.MqttService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point. Loads configuration from the directory given as the first argument
 * (default {@code ./data}, or {@code -Dbatteryhawk.config.dir}) and runs the MQTT service
 * until the JVM is asked to stop.
 */
public final class BatteryHawkServer {

    private static final Logger log = LoggerFactory.getLogger(BatteryHawkServer.class);

    private final ConfigManager config;
    private final ResilientMqttClient client;
    private final MqttService mqttService;

    BatteryHawkServer(ConfigManager config, ResilientMqttClient client) {
        this.config = config;
        this.client = client;
        this.mqttService = new MqttService(client);
    }

    void start() {
        config.start();
        mqttService.start();
        log.info("Battery Hawk server started");
    }

    void stop() {
        mqttService.stop();
        client.close();
        config.stop();
        log.info("Battery Hawk server stopped");
    }

    public static void main(String[] args) throws InterruptedException {
        String dir = args.length > 0 ? args[0] : System.getProperty("batteryhawk.config.dir", "./data");
        ConfigManager config = new ConfigManager(Path.of(dir));
        ResilientMqttClient client = ResilientMqttClient.fromConfig(config, new PahoBrokerTransport());
        BatteryHawkServer server = new BatteryHawkServer(config, client);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            stopped.countDown();
        }, "shutdown"));
        server.start();
        stopped.await();
    }
}
