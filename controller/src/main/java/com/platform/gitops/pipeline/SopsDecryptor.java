package com.platform.gitops.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ContainerNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationException;
import com.platform.gitops.manifest.ManifestParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decrypts values of the form {@code ENC[AES256_GCM,data:..,iv:..,tag:..,type:..]}.
 * Keys come from decryption secret entries whose name ends in {@code .aes256}, each holding a
 * base64 encoded 256-bit key; all of them are tried in turn. The top-level {@code sops}
 * metadata block is removed from every document.
 */
@Slf4j
@Component
public class SopsDecryptor implements Decryptor {
    
    public static final String PROVIDER = "sops";
    public static final String KEY_SUFFIX = ".aes256";
    
    private static final Pattern ENCRYPTED_VALUE = Pattern.compile(
        "^ENC\\[AES256_GCM,data:([^,]*),iv:([^,]+),tag:([^,]+),type:(str|int|float|bool)]$");
    private static final int GCM_TAG_BITS = 128;
    private static final int KEY_BYTES = 32;
    
    private final ManifestParser parser;
    
    public SopsDecryptor(ManifestParser parser) {
        this.parser = parser;
    }
    
    @Override
    public String getProvider() {
        return PROVIDER;
    }
    
    @Override
    public List<String> decrypt(List<String> documents, Map<String, String> keyMaterial) {
        List<SecretKeySpec> keys = keyring(keyMaterial);
        List<String> result = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            String document = documents.get(i);
            if (!document.contains("ENC[") && !document.contains("sops:")) {
                result.add(document);
                continue;
            }
            JsonNode root = parser.readTree(document);
            if (!(root instanceof ObjectNode object)) {
                result.add(document);
                continue;
            }
            object.remove("sops");
            decryptTree(object, "", keys, i + 1);
            result.add(parser.writeYaml(object));
        }
        return result;
    }
    
    private List<SecretKeySpec> keyring(Map<String, String> keyMaterial) {
        List<SecretKeySpec> keys = new ArrayList<>();
        for (Map.Entry<String, String> entry : keyMaterial.entrySet()) {
            if (!entry.getKey().endsWith(KEY_SUFFIX)) {
                continue;
            }
            byte[] raw;
            try {
                raw = Base64.getDecoder().decode(entry.getValue().strip());
            } catch (IllegalArgumentException e) {
                throw new ReconciliationException(ErrorCode.DECRYPTION_FAILED,
                    "key '" + entry.getKey() + "' is not valid base64", e);
            }
            if (raw.length != KEY_BYTES) {
                throw new ReconciliationException(ErrorCode.DECRYPTION_FAILED,
                    "key '" + entry.getKey() + "' must be " + KEY_BYTES + " bytes, got " + raw.length);
            }
            keys.add(new SecretKeySpec(raw, "AES"));
        }
        if (keys.isEmpty()) {
            throw new ReconciliationException(ErrorCode.DECRYPTION_FAILED,
                "decryption secret holds no '*" + KEY_SUFFIX + "' key");
        }
        return keys;
    }
    
    private void decryptTree(ContainerNode<?> node, String path, List<SecretKeySpec> keys, int document) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            List<Map.Entry<String, JsonNode>> replacements = new ArrayList<>();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String fieldPath = path + "/" + field.getKey();
                JsonNode value = field.getValue();
                if (value instanceof ContainerNode<?> child) {
                    decryptTree(child, fieldPath, keys, document);
                } else if (value.isTextual() && value.asText().startsWith("ENC[")) {
                    replacements.add(Map.entry(field.getKey(), decryptValue(value.asText(), fieldPath, keys, document)));
                }
            }
            replacements.forEach(r -> object.set(r.getKey(), r.getValue()));
        } else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                JsonNode value = array.get(i);
                String itemPath = path + "/" + i;
                if (value instanceof ContainerNode<?> child) {
                    decryptTree(child, itemPath, keys, document);
                } else if (value.isTextual() && value.asText().startsWith("ENC[")) {
                    array.set(i, decryptValue(value.asText(), itemPath, keys, document));
                }
            }
        }
    }
    
    private JsonNode decryptValue(String value, String path, List<SecretKeySpec> keys, int document) {
        Matcher matcher = ENCRYPTED_VALUE.matcher(value);
        if (!matcher.matches()) {
            throw failure(document, path, "malformed encrypted value");
        }
        byte[] data;
        byte[] iv;
        byte[] tag;
        try {
            data = Base64.getDecoder().decode(matcher.group(1));
            iv = Base64.getDecoder().decode(matcher.group(2));
            tag = Base64.getDecoder().decode(matcher.group(3));
        } catch (IllegalArgumentException e) {
            throw failure(document, path, "invalid base64 in encrypted value");
        }
        byte[] cipherText = new byte[data.length + tag.length];
        System.arraycopy(data, 0, cipherText, 0, data.length);
        System.arraycopy(tag, 0, cipherText, data.length, tag.length);
        
        for (SecretKeySpec key : keys) {
            try {
                Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
                cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
                String plain = new String(cipher.doFinal(cipherText), StandardCharsets.UTF_8);
                return typed(plain, matcher.group(4), document, path);
            } catch (java.security.GeneralSecurityException e) {
                log.trace("Key did not decrypt {} in document {}", path, document);
            }
        }
        throw failure(document, path, "no key in the keyring decrypts the value");
    }
    
    private JsonNode typed(String plain, String type, int document, String path) {
        try {
            return switch (type) {
                case "int" -> LongNode.valueOf(Long.parseLong(plain));
                case "float" -> DoubleNode.valueOf(Double.parseDouble(plain));
                case "bool" -> BooleanNode.valueOf(Boolean.parseBoolean(plain));
                default -> TextNode.valueOf(plain);
            };
        } catch (NumberFormatException e) {
            throw failure(document, path, "decrypted value is not a valid " + type);
        }
    }
    
    private static ReconciliationException failure(int document, String path, String detail) {
        return new ReconciliationException(ErrorCode.DECRYPTION_FAILED,
            String.format("document %d, field %s: %s", document, path, detail));
    }
}
