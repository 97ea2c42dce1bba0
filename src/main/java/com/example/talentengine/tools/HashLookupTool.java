package com.example.talentengine.tools;

import com.example.talentengine.hash.HashIndex;
import com.example.talentengine.persistence.GameDataLoader;
import com.example.talentengine.util.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the config name for each ability hash given on the command line.
 * Hashes may be signed or unsigned decimal, or hex with a 0x prefix.
 */
public class HashLookupTool {
    private static final Logger logger = LoggerFactory.getLogger(HashLookupTool.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            System.out.println("usage: HashLookupTool <hash> [hash...]");
            return;
        }
        EngineConfig config = EngineConfig.load();
        HashIndex index = HashIndex.build(GameDataLoader.loadAbilitiesFromYamlResource(config.getAbilitiesResource()));
        for (String arg : args) {
            Long hash = parseHash(arg);
            if (hash == null) {
                logger.warn("Not a hash: {}", arg);
                continue;
            }
            System.out.println(arg + " -> " + index.nameOrUnknown((int) hash.longValue()));
        }
    }

    public static Long parseHash(String s) {
        if (s == null) return null;
        String t = s.trim();
        try {
            long v = t.startsWith("0x") || t.startsWith("0X")
                    ? Long.parseLong(t.substring(2), 16)
                    : Long.parseLong(t);
            if (v < Integer.MIN_VALUE || v > 0xFFFFFFFFL) return null;
            return v;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
