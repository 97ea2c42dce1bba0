package com.example.talentengine.persistence;

import com.example.talentengine.avatar.AvatarDefinition;
import com.example.talentengine.model.AbilityConfig;
import com.example.talentengine.model.ConfigException;
import com.example.talentengine.model.ParamList;
import com.example.talentengine.talent.TalentData;
import com.example.talentengine.talent.TalentModifier;
import com.example.talentengine.talent.TalentModifiers;
import com.example.talentengine.util.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Loads ability configs, talents and avatar definitions from YAML resources.
 * JSON documents are valid YAML and load the same way.
 *
 * Bad records are logged and skipped; the rest of the file still loads.
 */
public class GameDataLoader {
    private static final Logger logger = LoggerFactory.getLogger(GameDataLoader.class);

    public static GameData loadAll(EngineConfig config) {
        Map<String, AbilityConfig> abilities = new LinkedHashMap<>();
        for (AbilityConfig a : loadAbilitiesFromYamlResource(config.getAbilitiesResource())) {
            if (abilities.put(a.abilityName(), a) != null) {
                logger.warn("Duplicate ability config '{}', keeping the later one", a.abilityName());
            }
        }
        Map<Integer, TalentData> talents = loadTalentsFromYamlResource(config.getTalentsResource());
        Map<Integer, AvatarDefinition> avatars = new TreeMap<>();
        for (AvatarDefinition def : loadAvatarsFromYamlResource(config.getAvatarsResource())) {
            avatars.put(def.id(), def);
        }
        return new GameData(abilities, talents, avatars);
    }

    // ========== Abilities ==========

    public static List<AbilityConfig> loadAbilitiesFromYamlResource(String resourcePath) {
        List<Map<String, Object>> records = readRecordList(resourcePath, "abilities");
        List<AbilityConfig> out = new ArrayList<>();
        for (Map<String, Object> record : records) {
            try {
                out.add(parseAbility(record));
            } catch (ConfigException e) {
                logger.warn("Skipping ability record in {}: {}", resourcePath, e.getMessage());
            }
        }
        logger.info("Loaded {} ability configs from {}", out.size(), resourcePath);
        return out;
    }

    public static AbilityConfig parseAbility(Map<String, Object> record) {
        String name = getString(record, "abilityName", null);
        Map<String, Double> specials = new LinkedHashMap<>();
        Object specialsObj = record.get("abilitySpecials");
        if (specialsObj instanceof Map) {
            for (Map.Entry<?, ?> e : ((Map<?, ?>) specialsObj).entrySet()) {
                Object v = e.getValue();
                if (v instanceof Number) {
                    specials.put(String.valueOf(e.getKey()), ((Number) v).doubleValue());
                } else {
                    // unset specials default to 0
                    specials.put(String.valueOf(e.getKey()), 0.0);
                }
            }
        }
        Set<String> modifiers = new LinkedHashSet<>();
        Object modifiersObj = record.get("modifiers");
        if (modifiersObj instanceof Map) {
            for (Object key : ((Map<?, ?>) modifiersObj).keySet()) {
                modifiers.add(String.valueOf(key));
            }
        }
        return new AbilityConfig(name, specials, modifiers);
    }

    // ========== Talents ==========

    public static Map<Integer, TalentData> loadTalentsFromYamlResource(String resourcePath) {
        List<Map<String, Object>> records = readRecordList(resourcePath, "talents");
        Map<Integer, TalentData> out = new TreeMap<>();
        for (Map<String, Object> record : records) {
            try {
                TalentData talent = parseTalent(record);
                out.put(talent.id(), talent);
            } catch (ConfigException e) {
                logger.warn("Skipping talent record in {}: {}", resourcePath, e.getMessage());
            }
        }
        logger.info("Loaded {} talents from {}", out.size(), resourcePath);
        return out;
    }

    /**
     * A bad open config drops only that modifier; the talent keeps the others in order.
     */
    @SuppressWarnings("unchecked")
    public static TalentData parseTalent(Map<String, Object> record) {
        int id = getInt(record, "id", -1);
        if (id < 0) throw new ConfigException("talent record without id");

        List<Number> params = new ArrayList<>();
        Object paramsObj = record.get("paramList");
        if (paramsObj instanceof List) {
            for (Object p : (List<?>) paramsObj) {
                params.add(p instanceof Number ? (Number) p : 0.0);
            }
        }

        List<TalentModifier> modifiers = new ArrayList<>();
        Object configsObj = record.get("openConfigs");
        if (configsObj instanceof List) {
            for (Object c : (List<?>) configsObj) {
                if (!(c instanceof Map)) continue;
                try {
                    modifiers.add(TalentModifiers.fromConfig((Map<String, Object>) c));
                } catch (ConfigException e) {
                    logger.warn("Talent {}: dropping open config: {}", id, e.getMessage());
                }
            }
        }
        return new TalentData(id, ParamList.fromNumbers(params), modifiers);
    }

    // ========== Avatars ==========

    public static List<AvatarDefinition> loadAvatarsFromYamlResource(String resourcePath) {
        List<Map<String, Object>> records = readRecordList(resourcePath, "avatars");
        List<AvatarDefinition> out = new ArrayList<>();
        for (Map<String, Object> record : records) {
            int id = getInt(record, "id", -1);
            if (id < 0) {
                logger.warn("Skipping avatar record without id in {}", resourcePath);
                continue;
            }
            List<String> abilityNames = new ArrayList<>();
            Object abilitiesObj = record.get("abilities");
            if (abilitiesObj instanceof List) {
                for (Object a : (List<?>) abilitiesObj) abilityNames.add(String.valueOf(a));
            }
            List<Integer> talentIds = new ArrayList<>();
            Object talentsObj = record.get("talents");
            if (talentsObj instanceof List) {
                for (Object t : (List<?>) talentsObj) {
                    if (t instanceof Number) talentIds.add(((Number) t).intValue());
                }
            }
            out.add(new AvatarDefinition(id, getString(record, "name", ""), abilityNames, talentIds));
        }
        logger.info("Loaded {} avatar definitions from {}", out.size(), resourcePath);
        return out;
    }

    // ========== Helpers ==========

    /**
     * Read a resource whose root is either a list of records or a map holding one under {@code rootKey}.
     */
    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> readRecordList(String resourcePath, String rootKey) {
        try (InputStream in = GameDataLoader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.warn("Data resource not found: {}", resourcePath);
                return Collections.emptyList();
            }
            Object root = new Yaml().load(in);
            Object listObj = root instanceof Map ? ((Map<String, Object>) root).get(rootKey) : root;
            if (!(listObj instanceof List)) return Collections.emptyList();
            List<Map<String, Object>> out = new ArrayList<>();
            for (Object o : (List<?>) listObj) {
                if (o instanceof Map) out.add((Map<String, Object>) o);
            }
            return out;
        } catch (Exception e) {
            logger.error("Failed to load {}: {}", resourcePath, e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    private static String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        return val != null ? String.valueOf(val) : defaultVal;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).intValue();
        if (val instanceof String) {
            try { return Integer.parseInt((String) val); } catch (Exception e) { return defaultVal; }
        }
        return defaultVal;
    }
}
