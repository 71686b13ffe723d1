package com.platform.gitops.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.gitops.config.TypeRegistryConfig;
import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationException;
import com.platform.gitops.manifest.ManifestParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SopsDecryptorTest {

    private final SecureRandom random = new SecureRandom();
    private ManifestParser parser;
    private SopsDecryptor decryptor;
    private byte[] key;

    @BeforeEach
    void setUp() {
        parser = new ManifestParser(new TypeRegistryConfig().typeRegistry(new ObjectMapper(), List.of()));
        decryptor = new SopsDecryptor(parser);
        key = new byte[32];
        random.nextBytes(key);
    }

    private String encrypt(String plain, String type, byte[] withKey) throws Exception {
        byte[] iv = new byte[12];
        random.nextBytes(iv);
        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(withKey, "AES"), new GCMParameterSpec(128, iv));
        byte[] sealed = cipher.doFinal(plain.getBytes(StandardCharsets.UTF_8));
        byte[] data = Arrays.copyOfRange(sealed, 0, sealed.length - 16);
        byte[] tag = Arrays.copyOfRange(sealed, sealed.length - 16, sealed.length);
        Base64.Encoder b64 = Base64.getEncoder();
        return String.format("ENC[AES256_GCM,data:%s,iv:%s,tag:%s,type:%s]",
            b64.encodeToString(data), b64.encodeToString(iv), b64.encodeToString(tag), type);
    }

    private Map<String, String> keyring(byte[]... keys) {
        Map<String, String> material = new LinkedHashMap<>();
        for (int i = 0; i < keys.length; i++) {
            material.put("key" + i + SopsDecryptor.KEY_SUFFIX, Base64.getEncoder().encodeToString(keys[i]));
        }
        material.put("README", "ignored");
        return material;
    }

    private String secret(String password, String port) {
        return """
            apiVersion: v1
            kind: Secret
            metadata:
              name: db
              namespace: apps
            stringData:
              password: "%s"
              port: "%s"
            sops:
              version: 3.8.1
            """.formatted(password, port);
    }

    @Test
    @DisplayName("Encrypted values are decrypted to their declared type and the sops block is dropped")
    void decryptsValues() throws Exception {
        String document = secret(encrypt("s3cret", "str", key), encrypt("5432", "int", key));

        List<String> out = decryptor.decrypt(List.of(document), keyring(key));

        JsonNode tree = parser.readTree(out.get(0));
        assertEquals("s3cret", tree.at("/stringData/password").asText());
        assertTrue(tree.at("/stringData/port").isIntegralNumber());
        assertEquals(5432, tree.at("/stringData/port").asInt());
        assertTrue(tree.path("sops").isMissingNode());
    }

    @Test
    void triesEveryKeyInTheKeyring() throws Exception {
        byte[] other = new byte[32];
        random.nextBytes(other);
        String document = secret(encrypt("s3cret", "str", key), encrypt("1", "int", key));

        List<String> out = decryptor.decrypt(List.of(document), keyring(other, key));

        assertEquals("s3cret", parser.readTree(out.get(0)).at("/stringData/password").asText());
    }

    @Test
    void plainDocumentsPassThrough() {
        String plain = "apiVersion: v1\nkind: ConfigMap\nmetadata:\n  name: a\n";

        assertEquals(List.of(plain), decryptor.decrypt(List.of(plain), keyring(key)));
    }

    @Test
    void wrongKeyFails() throws Exception {
        byte[] other = new byte[32];
        random.nextBytes(other);
        String document = secret(encrypt("s3cret", "str", key), encrypt("1", "int", key));

        ReconciliationException e = assertThrows(ReconciliationException.class,
            () -> decryptor.decrypt(List.of(document), keyring(other)));
        assertEquals(ErrorCode.DECRYPTION_FAILED, e.getErrorCode());
        assertTrue(e.getMessage().contains("document 1, field /stringData/password"));
    }

    @Test
    void keyringMustHoldAUsableKey() {
        assertThrows(ReconciliationException.class, () -> decryptor.decrypt(List.of(), Map.of("README", "x")));
        assertThrows(ReconciliationException.class,
            () -> decryptor.decrypt(List.of(), Map.of("k.aes256", Base64.getEncoder().encodeToString(new byte[16]))));
        assertThrows(ReconciliationException.class, () -> decryptor.decrypt(List.of(), Map.of("k.aes256", "%%%")));
    }

    @Test
    void malformedValueFails() {
        String document = secret("ENC[AES256_GCM,garbage]", "1");

        ReconciliationException e = assertThrows(ReconciliationException.class,
            () -> decryptor.decrypt(List.of(document), keyring(key)));
        assertTrue(e.getMessage().contains("malformed encrypted value"));
    }
}
