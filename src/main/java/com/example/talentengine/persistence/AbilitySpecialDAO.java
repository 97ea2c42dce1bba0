package com.example.talentengine.persistence;

import com.example.talentengine.model.SkillDepot;
import com.example.talentengine.model.TalentType;
import com.example.talentengine.util.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stores skill depot snapshots per owner (a live character) in H2.
 *
 * A save replaces all of the owner's rows in one transaction.
 */
public class AbilitySpecialDAO {
    private static final Logger logger = LoggerFactory.getLogger(AbilitySpecialDAO.class);

    private static final String[] OWNER_TABLES = {"ability_special", "ability_talent_param", "talent_extra_level"};

    private final String url;
    private final String user;
    private final String pass;

    public AbilitySpecialDAO() {
        this(EngineConfig.load());
    }

    public AbilitySpecialDAO(EngineConfig config) {
        this(config.getDbUrl(), config.getDbUser(), config.getDbPassword());
    }

    public AbilitySpecialDAO(String url, String user, String pass) {
        this.url = url;
        this.user = user;
        this.pass = pass;
        ensureTables();
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, pass);
    }

    private void ensureTables() {
        try (Connection c = connect();
             Statement s = c.createStatement()) {
            s.execute("""
                CREATE TABLE IF NOT EXISTS ability_special (
                    owner_id BIGINT NOT NULL,
                    ability_name VARCHAR(255) NOT NULL,
                    special_name VARCHAR(255) NOT NULL,
                    special_value REAL NOT NULL,
                    PRIMARY KEY (owner_id, ability_name, special_name)
                )
            """);
            s.execute("""
                CREATE TABLE IF NOT EXISTS ability_talent_param (
                    owner_id BIGINT NOT NULL,
                    ability_name VARCHAR(255) NOT NULL,
                    talent_param VARCHAR(255) NOT NULL,
                    PRIMARY KEY (owner_id, ability_name, talent_param)
                )
            """);
            s.execute("""
                CREATE TABLE IF NOT EXISTS talent_extra_level (
                    owner_id BIGINT NOT NULL,
                    talent_type VARCHAR(32) NOT NULL,
                    extra_level INT NOT NULL,
                    PRIMARY KEY (owner_id, talent_type)
                )
            """);
            logger.debug("AbilitySpecialDAO: tables ensured");
        } catch (SQLException e) {
            logger.warn("Failed to create ability special tables: {}", e.getMessage());
        }
    }

    /**
     * Replace the stored snapshot of {@code ownerId} with {@code depot}.
     *
     * @return false when the write failed and was rolled back
     */
    public boolean saveDepot(long ownerId, SkillDepot depot) {
        try (Connection c = connect()) {
            c.setAutoCommit(false);
            try {
                deleteRows(c, ownerId);
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO ability_special (owner_id, ability_name, special_name, special_value) VALUES (?, ?, ?, ?)")) {
                    for (Map.Entry<String, Map<String, Float>> ability : depot.getAbilitySpecials().entrySet()) {
                        for (Map.Entry<String, Float> special : ability.getValue().entrySet()) {
                            ps.setLong(1, ownerId);
                            ps.setString(2, ability.getKey());
                            ps.setString(3, special.getKey());
                            ps.setFloat(4, special.getValue());
                            ps.addBatch();
                        }
                    }
                    ps.executeBatch();
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO ability_talent_param (owner_id, ability_name, talent_param) VALUES (?, ?, ?)")) {
                    for (Map.Entry<String, Set<String>> e : depot.getUnlockedTalentParams().entrySet()) {
                        for (String param : e.getValue()) {
                            ps.setLong(1, ownerId);
                            ps.setString(2, e.getKey());
                            ps.setString(3, param);
                            ps.addBatch();
                        }
                    }
                    ps.executeBatch();
                }
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO talent_extra_level (owner_id, talent_type, extra_level) VALUES (?, ?, ?)")) {
                    for (Map.Entry<TalentType, Integer> e : depot.getExtraTalentLevels().entrySet()) {
                        ps.setLong(1, ownerId);
                        ps.setString(2, e.getKey().name());
                        ps.setInt(3, e.getValue());
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                c.commit();
                return true;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            logger.error("Failed to save skill depot for owner {}: {}", ownerId, e.getMessage());
            return false;
        }
    }

    /**
     * @return the stored snapshot, or empty when nothing is stored or the read failed
     */
    public Optional<SkillDepot> loadDepot(long ownerId) {
        SkillDepot depot = new SkillDepot();
        boolean found = false;
        try (Connection c = connect()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT ability_name, special_name, special_value FROM ability_special WHERE owner_id = ? ORDER BY ability_name, special_name")) {
                ps.setLong(1, ownerId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String ability = rs.getString(1);
                        depot.addAbility(ability, null);
                        depot.putSpecial(ability, rs.getString(2), rs.getFloat(3));
                        found = true;
                    }
                }
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT ability_name, talent_param FROM ability_talent_param WHERE owner_id = ?")) {
                ps.setLong(1, ownerId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String ability = rs.getString(1);
                        // abilities without specials still need an entry to hold unlocked params
                        depot.addAbility(ability, null);
                        depot.unlockTalentParam(ability, rs.getString(2));
                        found = true;
                    }
                }
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT talent_type, extra_level FROM talent_extra_level WHERE owner_id = ?")) {
                ps.setLong(1, ownerId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        TalentType type = TalentType.fromString(rs.getString(1));
                        if (type == null) {
                            logger.warn("Owner {}: ignoring unknown talent type '{}'", ownerId, rs.getString(1));
                            continue;
                        }
                        depot.addExtraTalentLevel(type, rs.getInt(2));
                        found = true;
                    }
                }
            }
        } catch (SQLException e) {
            logger.error("Failed to load skill depot for owner {}: {}", ownerId, e.getMessage());
            return Optional.empty();
        }
        return found ? Optional.of(depot) : Optional.empty();
    }

    public boolean deleteDepot(long ownerId) {
        try (Connection c = connect()) {
            deleteRows(c, ownerId);
            return true;
        } catch (SQLException e) {
            logger.error("Failed to delete skill depot for owner {}: {}", ownerId, e.getMessage());
            return false;
        }
    }

    private void deleteRows(Connection c, long ownerId) throws SQLException {
        for (String table : OWNER_TABLES) {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + table + " WHERE owner_id = ?")) {
                ps.setLong(1, ownerId);
                ps.executeUpdate();
            }
        }
    }
}
