package com.example.talentengine.hash;

/**
 * Hash used by clients to identify abilities, specials and modifiers by number:
 * {@code h = h * 131 + c} over the name's chars, wrapping at 32 bits.
 */
public final class AbilityHash {

    private AbilityHash() {
    }

    public static int hash(String name) {
        int h = 0;
        if (name == null) return h;
        for (int i = 0; i < name.length(); i++) {
            h = h * 131 + name.charAt(i);
        }
        return h;
    }

    /** The hash as the unsigned 32-bit number clients send. */
    public static long unsignedHash(String name) {
        return Integer.toUnsignedLong(hash(name));
    }
}
