package com.layeredcraft.cdk.utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import org.jetbrains.annotations.NotNull;
import software.amazon.awscdk.Stack;

/**
 * Builds CloudFormation export names in the form {@code {scope}-{resourceId}-{qualifier}}.
 *
 * Names are lowercased and never exceed {@value #MAX_EXPORT_NAME_LENGTH} characters. When the joined
 * name is too long it is cut to fit and suffixed with the first {@value #HASH_LENGTH} hex characters
 * of the SHA-256 digest of the full, untruncated name, so two long names that differ only in their
 * tail still get different exports.
 *
 * Lengths and the truncation point are counted in UTF-16 code units, so a supplementary character
 * straddling the cut is split. CloudFormation export names only allow alphanumerics, colons and
 * hyphens, so such names never deploy anyway.
 *
 * Examples:
 *   ("test-stack", "MyConstruct", "Arn") -> test-stack-myconstruct-arn
 *   ("stack", "", "arn")                 -> stack--arn
 */
public final class ExportNameGenerator {

    public static final int MAX_EXPORT_NAME_LENGTH = 256;
    public static final int HASH_LENGTH = 8;

    private static final String SEPARATOR = "-";

    private ExportNameGenerator() {}

    /**
     * @param scopeName usually the stack name
     * @param resourceId the construct id
     * @param qualifier discriminates exports of the same resource, e.g. "arn", "name", "gsi-0"
     * @return a lowercase export name of at most 256 characters
     * @throws IllegalArgumentException if any argument is null
     */
    public static @NotNull String generate(String scopeName, String resourceId, String qualifier) {
        requireNonNull(scopeName, "scopeName");
        requireNonNull(resourceId, "resourceId");
        requireNonNull(qualifier, "qualifier");

        String exportName = String.join(
                SEPARATOR,
                scopeName.toLowerCase(Locale.ROOT),
                resourceId.toLowerCase(Locale.ROOT),
                qualifier.toLowerCase(Locale.ROOT));

        if (exportName.length() <= MAX_EXPORT_NAME_LENGTH) {
            return exportName;
        }

        // Hash before truncating: the suffix must cover the part that gets cut off
        String hash = sha256Hex(exportName).substring(0, HASH_LENGTH);
        int maxBaseLength = MAX_EXPORT_NAME_LENGTH - hash.length() - SEPARATOR.length();
        return exportName.substring(0, Math.min(maxBaseLength, exportName.length())) + SEPARATOR + hash;
    }

    /**
     * Export name scoped to the stack's name.
     */
    public static @NotNull String forStack(@NotNull Stack stack, String resourceId, String qualifier) {
        return generate(stack.getStackName(), resourceId, qualifier);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available in this JVM", e);
        }
    }

    private static void requireNonNull(String value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
    }
}
