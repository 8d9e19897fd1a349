/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.messaging.paho;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.io.IOException;
import java.util.Base64;
import java.util.Collection;

/**
 * Builds an {@link SSLContext} from PEM files.
 *
 * <ul>
 *   <li>{@code ca_cert}: CA certificate or chain; the JVM trust store is used when absent</li>
 *   <li>{@code cert_file} + {@code key_file}: client certificate and PKCS#8 or PKCS#1 key for mutual TLS</li>
 * </ul>
 */
public final class SslHelper {

    private static final Logger log = LoggerFactory.getLogger(SslHelper.class);
    private static final String PROTOCOL = "TLS";

    private SslHelper() {}

    public static SSLContext createSslContext(String caCertPath, String certPath, String keyPath)
            throws GeneralSecurityException, IOException {
        TrustManager[] trustManagers = null;
        if (caCertPath != null) {
            X509Certificate[] caCerts = loadCertificateChain(caCertPath);
            KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);
            for (int i = 0; i < caCerts.length; i++) {
                trustStore.setCertificateEntry("ca-" + i, caCerts[i]);
            }
            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);
            trustManagers = tmf.getTrustManagers();
            log.info("Loaded {} CA certificate(s) from {}", caCerts.length, caCertPath);
        }

        KeyManager[] keyManagers = null;
        if (certPath != null && keyPath != null) {
            KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
            keyStore.load(null, null);
            char[] emptyPass = new char[0];
            keyStore.setKeyEntry("client", loadPrivateKey(keyPath), emptyPass, loadCertificateChain(certPath));
            KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(keyStore, emptyPass);
            keyManagers = kmf.getKeyManagers();
            log.info("Loaded client certificate from {}", certPath);
        } else if (certPath != null || keyPath != null) {
            log.warn("Both cert_file and key_file are needed for client authentication, ignoring the one given");
        }

        SSLContext context = SSLContext.getInstance(PROTOCOL);
        context.init(keyManagers, trustManagers, new SecureRandom());
        return context;
    }

    static X509Certificate[] loadCertificateChain(String path) throws GeneralSecurityException, IOException {
        CertificateFactory cf = CertificateFactory.getInstance("X.509");
        try (InputStream is = Files.newInputStream(Path.of(path))) {
            Collection<? extends Certificate> certs = cf.generateCertificates(is);
            return certs.toArray(new X509Certificate[0]);
        }
    }

    static PrivateKey loadPrivateKey(String path) throws GeneralSecurityException, IOException {
        String pem = Files.readString(Path.of(path)).trim();
        if (pem.contains("BEGIN RSA PRIVATE KEY")) {
            byte[] pkcs1 = decodePem(pem, "RSA PRIVATE KEY");
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(wrapPkcs1(pkcs1)));
        }
        if (pem.contains("BEGIN PRIVATE KEY")) {
            PKCS8EncodedKeySpec spec = new PKCS8EncodedKeySpec(decodePem(pem, "PRIVATE KEY"));
            try {
                return KeyFactory.getInstance("RSA").generatePrivate(spec);
            } catch (InvalidKeySpecException e) {
                return KeyFactory.getInstance("EC").generatePrivate(spec);
            }
        }
        throw new InvalidKeySpecException("Unsupported private key format in " + path
                + " (expected PKCS#8 or PKCS#1 PEM)");
    }

    private static byte[] decodePem(String pem, String label) {
        String base64 = pem
                .replace("-----BEGIN " + label + "-----", "")
                .replace("-----END " + label + "-----", "")
                .replaceAll("\\s+", "");
        return Base64.getDecoder().decode(base64);
    }

    /** PKCS#1 RSA key inside a PKCS#8 PrivateKeyInfo envelope. */
    private static byte[] wrapPkcs1(byte[] pkcs1) {
        byte[] rsaOid = {0x06, 0x09, 0x2A, (byte) 0x86, 0x48, (byte) 0x86, (byte) 0xF7, 0x0D, 0x01, 0x01, 0x01};
        byte[] nullParam = {0x05, 0x00};
        byte[] version = {0x02, 0x01, 0x00};
        byte[] algorithm = tag((byte) 0x30, concat(rsaOid, nullParam));
        byte[] key = tag((byte) 0x04, pkcs1);
        return tag((byte) 0x30, concat(version, concat(algorithm, key)));
    }

    private static byte[] tag(byte tag, byte[] data) {
        byte[] length = derLength(data.length);
        byte[] out = new byte[1 + length.length + data.length];
        out[0] = tag;
        System.arraycopy(length, 0, out, 1, length.length);
        System.arraycopy(data, 0, out, 1 + length.length, data.length);
        return out;
    }

    private static byte[] derLength(int length) {
        if (length < 0x80) return new byte[]{(byte) length};
        if (length < 0x100) return new byte[]{(byte) 0x81, (byte) length};
        return new byte[]{(byte) 0x82, (byte) (length >> 8), (byte) length};
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
