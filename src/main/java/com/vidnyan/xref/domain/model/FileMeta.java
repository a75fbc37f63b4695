package com.vidnyan.xref.domain.model;

import java.nio.charset.Charset;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Metadata of an analyzed file, written next to its cooked AST so that a later pass can
 * emit file facts without re-reading the source.
 */
public record FileMeta(
    String corpus,
    String root,
    String path,
    String language,
    String contentsBase64,
    String sha1,
    String encoding
) {

    public static final String LANGUAGE = "python";

    public static FileMeta of(String corpus, String root, String path, byte[] contents, Charset encoding) {
        return new FileMeta(
                corpus,
                root,
                path,
                LANGUAGE,
                Base64.getEncoder().encodeToString(contents),
                sha1Hex(contents),
                encoding.name().toLowerCase(Locale.ROOT));
    }

    static String sha1Hex(byte[] contents) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(contents));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
