package com.rolebridge.security;

import com.rolebridge.security.role.RoleKind;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Role naming by kind prefix plus a reversible encoding of the identifier.
 *
 * <p>With the default prefixes user {@code smith} becomes {@code user_smith} and group {@code
 * librarians} becomes {@code role_librarians}.
 *
 * <p>Encoding of the identifier's UTF-8 bytes:
 *
 * <ul>
 *   <li>{@code a-z} and {@code 0-9} are kept
 *   <li>{@code _} becomes {@code __}
 *   <li>any other byte becomes {@code _} followed by two lower-case hex digits, so {@code S}
 *       becomes {@code _53} and {@code .} becomes {@code _2e}
 * </ul>
 *
 * <p>The encoding is injective and the two prefixes are required to be distinct and not prefixes of
 * one another, so no two identities share a name. Names longer than {@code maxLength} are rejected
 * rather than truncated.
 */
public final class PrefixRoleNamingPolicy implements RoleNamingPolicy {

    /** PostgreSQL's NAMEDATALEN - 1. */
    public static final int POSTGRES_MAX_IDENTIFIER_LENGTH = 63;

    public static final String DEFAULT_USER_PREFIX = "user_";
    public static final String DEFAULT_GROUP_PREFIX = "role_";

    /** Built-in and bookkeeping role names that identities must never map onto. */
    public static final List<String> DEFAULT_RESERVED_PATTERNS =
            List.of("^pg_.*", "^postgres$", "^rolebridge_.*", "^public$");

    private static final Pattern PREFIX_SHAPE = Pattern.compile("[a-z][a-z0-9]*_");
    private static final HexFormat HEX = HexFormat.of();

    private final String userPrefix;
    private final String groupPrefix;
    private final List<Pattern> reserved;
    private final int maxLength;

    public PrefixRoleNamingPolicy(
            String userPrefix, String groupPrefix, List<String> reservedPatterns, int maxLength) {
        requirePrefix("userPrefix", userPrefix);
        requirePrefix("groupPrefix", groupPrefix);
        if (userPrefix.startsWith(groupPrefix) || groupPrefix.startsWith(userPrefix)) {
            throw new IllegalArgumentException(
                    "prefixes '%s' and '%s' overlap".formatted(userPrefix, groupPrefix));
        }
        if (maxLength <= Math.max(userPrefix.length(), groupPrefix.length())) {
            throw new IllegalArgumentException("maxLength leaves no room for identifiers");
        }
        this.userPrefix = userPrefix;
        this.groupPrefix = groupPrefix;
        this.reserved = reservedPatterns.stream().map(Pattern::compile).toList();
        this.maxLength = maxLength;
    }

    /** Policy with {@code user_} / {@code role_} prefixes and PostgreSQL limits. */
    public static PrefixRoleNamingPolicy defaults() {
        return new PrefixRoleNamingPolicy(
                DEFAULT_USER_PREFIX,
                DEFAULT_GROUP_PREFIX,
                DEFAULT_RESERVED_PATTERNS,
                POSTGRES_MAX_IDENTIFIER_LENGTH);
    }

    @Override
    public String roleName(RoleKind kind, String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("identifier must not be null or empty");
        }
        String name = prefixFor(kind) + encode(identifier);
        if (name.length() > maxLength) {
            throw new NamingConflictException(
                    identifier, name, "longer than %d characters".formatted(maxLength));
        }
        for (Pattern pattern : reserved) {
            if (pattern.matcher(name).matches()) {
                throw new NamingConflictException(
                        identifier, name, "matches reserved pattern " + pattern.pattern());
            }
        }
        return name;
    }

    @Override
    public Optional<RoleIdentity> identityOf(String roleName) {
        if (roleName == null) {
            return Optional.empty();
        }
        RoleKind kind;
        String encoded;
        if (roleName.startsWith(userPrefix)) {
            kind = RoleKind.USER_ROLE;
            encoded = roleName.substring(userPrefix.length());
        } else if (roleName.startsWith(groupPrefix)) {
            kind = RoleKind.GROUP_ROLE;
            encoded = roleName.substring(groupPrefix.length());
        } else {
            return Optional.empty();
        }
        return decode(encoded).map(identifier -> new RoleIdentity(kind, identifier));
    }

    public String userPrefix() {
        return userPrefix;
    }

    public String groupPrefix() {
        return groupPrefix;
    }

    public int maxLength() {
        return maxLength;
    }

    private String prefixFor(RoleKind kind) {
        return switch (kind) {
            case USER_ROLE -> userPrefix;
            case GROUP_ROLE -> groupPrefix;
            case UNMANAGED -> throw new IllegalArgumentException("UNMANAGED roles have no derived name");
        };
    }

    static String encode(String identifier) {
        StringBuilder out = new StringBuilder(identifier.length() + 8);
        for (byte b : identifier.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xff);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                out.append(c);
            } else if (c == '_') {
                out.append("__");
            } else {
                out.append('_').append(HEX.toHexDigits(b));
            }
        }
        return out.toString();
    }

    static Optional<String> decode(String encoded) {
        if (encoded.isEmpty()) {
            return Optional.empty();
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(encoded.length());
        int i = 0;
        while (i < encoded.length()) {
            char c = encoded.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                bytes.write(c);
                i++;
            } else if (c == '_' && i + 1 < encoded.length() && encoded.charAt(i + 1) == '_') {
                bytes.write('_');
                i += 2;
            } else if (c == '_' && isHex(encoded, i + 1)) {
                bytes.write(HEX.fromHexDigits(encoded, i + 1, i + 3));
                i += 3;
            } else {
                return Optional.empty();
            }
        }
        String decoded = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        // only canonical encodings decode; "_61" is not how 'a' is written
        return encode(decoded).equals(encoded) ? Optional.of(decoded) : Optional.empty();
    }

    private static boolean isHex(String s, int from) {
        return from + 1 < s.length()
                && HexFormat.isHexDigit(s.charAt(from))
                && HexFormat.isHexDigit(s.charAt(from + 1))
                && !Character.isUpperCase(s.charAt(from))
                && !Character.isUpperCase(s.charAt(from + 1));
    }

    private static void requirePrefix(String field, String prefix) {
        if (prefix == null || !PREFIX_SHAPE.matcher(prefix).matches()) {
            throw new IllegalArgumentException(
                    field + " must be lower-case letters/digits ending in '_', got: " + prefix);
        }
    }
}
