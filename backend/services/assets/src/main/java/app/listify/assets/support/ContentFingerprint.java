package app.listify.assets.support;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 of a file's bytes, hashed in fixed-size chunks.
 */
public record ContentFingerprint(String hex) {

    private static final int BUFFER_SIZE = 8192;

    public static ContentFingerprint of(Path file) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return new ContentFingerprint(HexFormat.of().formatHex(digest.digest()));
    }

    public String shortForm() {
        return hex.length() <= 8 ? hex : hex.substring(0, 8);
    }

    @Override
    public String toString() {
        return hex;
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
