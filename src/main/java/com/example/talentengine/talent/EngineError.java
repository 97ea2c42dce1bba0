package com.example.talentengine.talent;

/**
 * Failure kinds reported while applying talent modifiers or building the hash index.
 */
public enum EngineError {
    /** Target ability name is not present in the skill depot. */
    UNKNOWN_ABILITY,
    /** Target special name is not present in the ability's specials table. */
    UNKNOWN_SPECIAL,
    /** An indexed reference string does not parse to an integer index. */
    MALFORMED_REFERENCE,
    /** A parsed index falls outside the parameter list. */
    INDEX_OUT_OF_RANGE,
    /** Two distinct names hash to the same value. Logged, never fatal. */
    HASH_COLLISION
}
