package com.example.talentengine.avatar;

import com.example.talentengine.persistence.GameData;
import com.example.talentengine.talent.TalentModifierEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Compiled data for every avatar definition, keyed by avatar id.
 */
public class AvatarCatalogue {
    private static final Logger logger = LoggerFactory.getLogger(AvatarCatalogue.class);

    private final Map<Integer, AvatarCompiledData> avatars;

    private AvatarCatalogue(Map<Integer, AvatarCompiledData> avatars) {
        this.avatars = Collections.unmodifiableMap(new TreeMap<>(avatars));
    }

    /**
     * Compile all avatars. With {@code parallel} set, avatars compile concurrently;
     * each compilation only reads the shared game data.
     */
    public static AvatarCatalogue compileAll(GameData data, TalentModifierEngine engine, boolean parallel) {
        Map<Integer, AvatarCompiledData> out = new ConcurrentHashMap<>();
        Stream<AvatarDefinition> defs = data.avatars().values().stream();
        if (parallel) defs = defs.parallel();
        defs.forEach(def -> out.put(def.id(), new AvatarCompiledData(def, data.abilities(), data.talents(), engine)));
        logger.info("Compiled {} avatars", out.size());
        return new AvatarCatalogue(out);
    }

    /** @return compiled data, or null for an unknown avatar id */
    public AvatarCompiledData get(int avatarId) {
        return avatars.get(avatarId);
    }

    public Map<Integer, AvatarCompiledData> getAll() { return avatars; }

    public int size() { return avatars.size(); }
}
