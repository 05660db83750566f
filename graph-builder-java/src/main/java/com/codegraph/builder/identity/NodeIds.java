package com.codegraph.builder.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Generates deterministic, content-addressed node IDs:
 *   declaration: first 64 bits of sha256(fqname + sig)
 *   file:        first 64 bits of sha256("file\0" + path)
 *
 * The file derivation is domain-separated so a file path never hashes to the
 * same ID as a declaration whose fqname+sig spells the same string.
 */
public final class NodeIds {

    public static final int ID_LENGTH = 16;

    private static final String FILE_DOMAIN = "file\u0000";

    private NodeIds() {}

    public static String forDeclaration(String fqname, String sig) {
        return truncatedSha256(nullToEmpty(fqname) + nullToEmpty(sig));
    }

    public static String forFile(String path) {
        return truncatedSha256(FILE_DOMAIN + nullToEmpty(path));
    }

    private static String truncatedSha256(String input) {
        byte[] digest = sha256().digest(input.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest, 0, ID_LENGTH / 2);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every Java platform is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
