package com.zplat.ipld.utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class RowKeys {

    private static final char SEPARATOR = '\u001F';

    private RowKeys() {
    }

    /** SHA-256 of the given columns; null and empty are distinct. */
    public static String of(String... columns) {
        StringBuilder sb = new StringBuilder();
        for (String column : columns) {
            sb.append(column == null ? "\u0000" : column).append(SEPARATOR);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(sb.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
