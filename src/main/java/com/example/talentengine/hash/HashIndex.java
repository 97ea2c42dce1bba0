package com.example.talentengine.hash;

import com.example.talentengine.model.AbilityConfig;
import com.example.talentengine.talent.EngineError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Reverse lookup from a 32-bit name hash to the ability, special or modifier name it came from.
 *
 * Built once from all loaded ability configs and read-only afterwards, so it is safe for
 * concurrent reads. When two distinct names collide the later one wins; the collision is
 * logged and counted but not corrected.
 */
public final class HashIndex {
    private static final Logger logger = LoggerFactory.getLogger(HashIndex.class);

    public static final String UNKNOWN = "unknown";
    public static final HashIndex EMPTY = new HashIndex(Collections.emptyMap(), 0);

    private final Map<Integer, String> names;
    private final int collisionCount;

    private HashIndex(Map<Integer, String> names, int collisionCount) {
        this.names = names;
        this.collisionCount = collisionCount;
    }

    public static HashIndex build(Collection<AbilityConfig> configs) {
        return build(configs, AbilityHash::hash);
    }

    /**
     * Index every ability name, special name and modifier name of {@code configs}, in iteration order.
     */
    public static HashIndex build(Collection<AbilityConfig> configs, ToIntFunction<String> hashFunction) {
        Builder builder = new Builder(hashFunction);
        if (configs != null) {
            for (AbilityConfig config : configs) {
                builder.add(config.abilityName());
                for (String special : config.abilitySpecials().keySet()) {
                    builder.add(special);
                }
                for (String modifier : config.modifierNames()) {
                    builder.add(modifier);
                }
            }
        }
        HashIndex index = builder.build();
        logger.info("Ability hash index built: {} names, {} collisions", index.size(), index.getCollisionCount());
        return index;
    }

    public Optional<String> lookup(int hash) {
        return Optional.ofNullable(names.get(hash));
    }

    /** Lookup by the unsigned 32-bit form; values outside 0..2^32-1 are never found. */
    public Optional<String> lookupUnsigned(long hash) {
        if (hash < 0 || hash > 0xFFFFFFFFL) return Optional.empty();
        return lookup((int) hash);
    }

    /** The originating name, or {@link #UNKNOWN}. */
    public String nameOrUnknown(int hash) {
        return names.getOrDefault(hash, UNKNOWN);
    }

    public boolean contains(int hash) {
        return names.containsKey(hash);
    }

    public int size() { return names.size(); }

    public int getCollisionCount() { return collisionCount; }

    /**
     * Accumulates names for an index. Not thread-safe; discard after {@link #build()}.
     */
    public static final class Builder {
        private final ToIntFunction<String> hashFunction;
        private final Map<Integer, String> names = new HashMap<>();
        private int collisions;

        public Builder(ToIntFunction<String> hashFunction) {
            this.hashFunction = hashFunction;
        }

        public Builder add(String name) {
            if (name == null) return this;
            int hash = hashFunction.applyAsInt(name);
            String previous = names.put(hash, name);
            if (previous != null && !previous.equals(name)) {
                collisions++;
                logger.warn("{}: hash {} maps to both '{}' and '{}'; keeping '{}'",
                        EngineError.HASH_COLLISION,
                        Integer.toUnsignedString(hash), previous, name, name);
            }
            return this;
        }

        public HashIndex build() {
            return new HashIndex(Collections.unmodifiableMap(new HashMap<>(names)), collisions);
        }
    }
}
