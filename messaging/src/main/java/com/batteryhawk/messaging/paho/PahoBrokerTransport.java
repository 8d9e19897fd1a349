/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.paho;

import com.batteryhawk.common.exception.BrokerConnectionException;
import com.batteryhawk.messaging.core.BrokerTransport;
import com.batteryhawk.messaging.core.MqttSettings;
import com.batteryhawk.messaging.core.TransportHandle;
import com.batteryhawk.messaging.core.TransportListener;
import org.eclipse.paho.mqttv5.client.MqttAsyncClient;
import org.eclipse.paho.mqttv5.client.MqttConnectionOptions;
import org.eclipse.paho.mqttv5.client.persist.MemoryPersistence;
import org.eclipse.paho.mqttv5.common.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.UUID;

/**
 * {@link BrokerTransport} backed by the Eclipse Paho MQTT v5 async client.
 *
 * <p>Paho's own automatic reconnect is switched off; recovery belongs to the connection manager.
 * Each {@link #connect} creates a fresh client with in-memory persistence.</p>
 */
public class PahoBrokerTransport implements BrokerTransport {

    private static final Logger log = LoggerFactory.getLogger(PahoBrokerTransport.class);

    @Override
    public TransportHandle connect(MqttSettings settings, Duration timeout, TransportListener listener) {
        String uri = serverUri(settings);
        String clientId = clientId(settings);
        MqttAsyncClient client;
        try {
            client = new MqttAsyncClient(uri, clientId, new MemoryPersistence());
        } catch (MqttException e) {
            throw new BrokerConnectionException("Invalid MQTT client parameters for " + uri + ": " + e.getMessage(),
                    settings.endpoint(), e);
        }

        PahoTransportHandle handle = new PahoTransportHandle(client, timeout);
        client.setCallback(new PahoCallbackBridge(listener));
        try {
            client.connect(buildOptions(settings, timeout)).waitForCompletion(timeout.toMillis());
        } catch (MqttException e) {
            handle.close();
            throw new BrokerConnectionException("MQTT connect to " + uri + " failed: " + e.getMessage(),
                    settings.endpoint(), e);
        }
        if (!client.isConnected()) {
            handle.close();
            throw new BrokerConnectionException("MQTT connect to " + uri + " did not complete",
                    settings.endpoint(), null);
        }
        log.debug("Paho client '{}' connected to {}", clientId, uri);
        return handle;
    }

    static String serverUri(MqttSettings settings) {
        return (settings.isTls() ? "ssl://" : "tcp://") + settings.getBroker() + ":" + settings.getPort();
    }

    static String clientId(MqttSettings settings) {
        String configured = blankToNull(settings.getClientId());
        if (configured != null) {
            return configured;
        }
        return "batteryhawk-" + UUID.randomUUID().toString().substring(0, 8);
    }

    MqttConnectionOptions buildOptions(MqttSettings settings, Duration timeout) {
        MqttConnectionOptions options = new MqttConnectionOptions();
        options.setCleanStart(true);
        options.setAutomaticReconnect(false);
        options.setKeepAliveInterval(settings.getKeepalive());
        options.setConnectionTimeout((int) Math.max(1, timeout.toSeconds()));
        String username = blankToNull(settings.getUsername());
        if (username != null) {
            options.setUserName(username);
            String password = blankToNull(settings.getPassword());
            if (password != null) {
                options.setPassword(password.getBytes(StandardCharsets.UTF_8));
            }
        }
        if (settings.isTls()) {
            try {
                options.setSocketFactory(SslHelper.createSslContext(blankToNull(settings.getCaCert()),
                        blankToNull(settings.getCertFile()), blankToNull(settings.getKeyFile())).getSocketFactory());
            } catch (GeneralSecurityException | IOException e) {
                throw new BrokerConnectionException("Failed to set up TLS for " + settings.endpoint() + ": "
                        + e.getMessage(), settings.endpoint(), e);
            }
        }
        return options;
    }

    /** Config files use empty strings for unset optional values. */
    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
