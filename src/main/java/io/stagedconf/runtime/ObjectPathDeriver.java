package io.stagedconf.runtime;

import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.error.ErrorKind;
import io.stagedconf.object.type.ObjectType;
import io.stagedconf.storage.RuntimeObjectStorage;
import io.stagedconf.storage.pkg.impl.FileConfigPackageStore;
import lombok.RequiredArgsConstructor;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Computes where the file of a new runtime object lives:
 * {@code <active stage>/conf.d/<lower-case plural type>/<escaped name>.conf}.
 */
@RequiredArgsConstructor
public final class ObjectPathDeriver {
    static final String ILLEGAL_CHARS = "<>:\"/\\|?*";
    static final String FILE_SUFFIX = ".conf";

    /* Common file name limit (ext4, xfs, NTFS) */
    static final int MAX_FILE_NAME_BYTES = 255;

    /* 80 bytes of name, "...", 40 hex chars of SHA-1 */
    static final int HASHED_PREFIX_BYTES = 80;
    static final int HASHED_NAME_MAX_BYTES = HASHED_PREFIX_BYTES + 3 + 40;

    private final RuntimeObjectStorage storage;

    /**
     * @throws ConfigObjectException with kind PATH if the name is too long for the file system
     * @throws io.stagedconf.storage.PackageRepairException if the package has no usable stage
     */
    public Path computeNewObjectConfigPath(final ObjectType type, final String fullName) throws ConfigObjectException {
        final Path prefix = storage.getConfigDir()
                .resolve(FileConfigPackageStore.CONF_DIR)
                .resolve(type.getPluralName().toLowerCase(Locale.ROOT));

        final String escapedName = escapeName(fullName);

        /* Peers running older versions derive the long name for every other type. */
        if (HighChurnTypes.contains(type)) {
            return prefix.resolve(truncateUsingHash(escapedName) + FILE_SUFFIX);
        }

        final String fileName = escapedName + FILE_SUFFIX;
        if (fileName.getBytes(StandardCharsets.UTF_8).length > MAX_FILE_NAME_BYTES) {
            throw new ConfigObjectException(ErrorKind.PATH, "Name of object '" + fullName + "' of type '"
                    + type.getName() + "' is too long: the file name would exceed " + MAX_FILE_NAME_BYTES + " bytes.");
        }
        return prefix.resolve(fileName);
    }

    /**
     * Percent-encodes characters that are not allowed in file names, and {@code %} itself.
     */
    public static String escapeName(final String name) {
        final StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            final char c = name.charAt(i);
            if (c == '%' || ILLEGAL_CHARS.indexOf(c) >= 0) {
                sb.append('%').append(String.format("%02X", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String unescapeName(final String escaped) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream(escaped.length());
        final byte[] bytes = escaped.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '%' && i + 2 < bytes.length && isHex(bytes[i + 1]) && isHex(bytes[i + 2])) {
                out.write(Integer.parseInt(new String(bytes, i + 1, 2, StandardCharsets.US_ASCII), 16));
                i += 2;
            } else {
                out.write(bytes[i]);
            }
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    /**
     * Names longer than {@value #HASHED_NAME_MAX_BYTES} bytes become
     * {@code <up to 80 bytes>...<sha1 hex>}; shorter names are returned unchanged. The prefix
     * never splits a multi-byte character.
     */
    static String truncateUsingHash(final String name) {
        final byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= HASHED_NAME_MAX_BYTES) return name;

        final StringBuilder prefix = new StringBuilder();
        int used = 0;
        for (int i = 0; i < name.length(); ) {
            final int cp = name.codePointAt(i);
            final int len = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8).length;
            if (used + len > HASHED_PREFIX_BYTES) break;
            prefix.appendCodePoint(cp);
            used += len;
            i += Character.charCount(cp);
        }

        return prefix + "..." + sha1Hex(bytes);
    }

    private static String sha1Hex(final byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(data));
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    private static boolean isHex(final byte b) {
        return (b >= '0' && b <= '9') || (b >= 'A' && b <= 'F') || (b >= 'a' && b <= 'f');
    }
}
