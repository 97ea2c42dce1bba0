package com.example.talentengine;

import com.example.talentengine.avatar.AvatarCatalogue;
import com.example.talentengine.hash.HashIndex;
import com.example.talentengine.persistence.GameData;
import com.example.talentengine.persistence.GameDataLoader;
import com.example.talentengine.talent.TalentModifierEngine;
import com.example.talentengine.util.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup wiring: load configs, build the hash index once, compile avatar data.
 * The result is read-only and can be shared by every session and world.
 */
public class TalentEngine {
    private static final Logger logger = LoggerFactory.getLogger(TalentEngine.class);

    private final GameData gameData;
    private final HashIndex hashIndex;
    private final TalentModifierEngine modifierEngine;
    private final AvatarCatalogue avatars;

    public TalentEngine(GameData gameData) {
        this.gameData = gameData;
        this.hashIndex = HashIndex.build(gameData.abilities().values());
        this.modifierEngine = new TalentModifierEngine(hashIndex);
        this.avatars = AvatarCatalogue.compileAll(gameData, modifierEngine, true);
    }

    public static TalentEngine start(EngineConfig config) {
        long t0 = System.currentTimeMillis();
        TalentEngine engine = new TalentEngine(GameDataLoader.loadAll(config));
        logger.info("Talent engine ready in {} ms: {} abilities, {} talents, {} avatars",
                System.currentTimeMillis() - t0,
                engine.gameData.abilities().size(),
                engine.gameData.talents().size(),
                engine.avatars.size());
        return engine;
    }

    public GameData getGameData() { return gameData; }
    public HashIndex getHashIndex() { return hashIndex; }
    public TalentModifierEngine getModifierEngine() { return modifierEngine; }
    public AvatarCatalogue getAvatars() { return avatars; }
}
