package com.example.talentengine.talent;

import com.example.talentengine.hash.HashIndex;
import com.example.talentengine.model.ParamList;
import com.example.talentengine.model.SkillDepot;
import com.example.talentengine.predicate.Predicate;
import com.example.talentengine.predicate.PredicateContext;
import com.example.talentengine.predicate.Predicates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Applies talent modifiers to skill depots.
 *
 * Each modifier is applied on its own: a failure is logged, reported in the returned
 * {@link ApplyResult} and leaves the depot as it was, and later modifiers in the same batch
 * still run. Batches are applied in the order given.
 *
 * The engine itself holds no mutable state. It may be shared across threads as long as each
 * depot has a single writer.
 */
public class TalentModifierEngine {
    private static final Logger logger = LoggerFactory.getLogger(TalentModifierEngine.class);

    private final HashIndex hashIndex;

    public TalentModifierEngine() {
        this(HashIndex.EMPTY);
    }

    public TalentModifierEngine(HashIndex hashIndex) {
        this.hashIndex = hashIndex == null ? HashIndex.EMPTY : hashIndex;
    }

    public HashIndex getHashIndex() { return hashIndex; }

    /**
     * Translate a client-sent ability/special/modifier hash into its config name,
     * or {@link HashIndex#UNKNOWN}.
     */
    public String resolveName(int hash) {
        return hashIndex.nameOrUnknown(hash);
    }

    // ========== Single modifier ==========

    public ApplyResult apply(TalentModifier modifier, SkillDepot depot, ParamList params) {
        Objects.requireNonNull(modifier, "modifier");
        Objects.requireNonNull(depot, "depot");
        try {
            modifier.apply(depot, params == null ? ParamList.EMPTY : params);
            logger.debug("[talent] applied {}", modifier);
            return ApplyResult.applied();
        } catch (EngineException e) {
            logger.warn("[talent] skipped {} modifier: {} ({})", modifier.type(), e.getMessage(), e.getError());
            return ApplyResult.failure(e.getError(), e.getMessage());
        }
    }

    /**
     * Apply {@code modifier} only when {@code gate} passes for {@code context}.
     * A null gate always passes. The gate is re-evaluated on every call.
     *
     * @throws NullPointerException when a gate is given without a context
     */
    public ApplyResult apply(TalentModifier modifier, SkillDepot depot, ParamList params,
                             Predicate gate, PredicateContext context) {
        if (gate != null) {
            Objects.requireNonNull(context, "context");
        }
        if (!evaluatePredicate(gate, context)) {
            logger.debug("[talent] {} gated off by {}", modifier, gate);
            return ApplyResult.gated();
        }
        return apply(modifier, depot, params);
    }

    public boolean evaluatePredicate(Predicate predicate, PredicateContext context) {
        return Predicates.evaluate(predicate, context);
    }

    // ========== Batches ==========

    public BatchResult applyAll(List<? extends TalentModifier> modifiers, SkillDepot depot, ParamList params) {
        BatchResult batch = new BatchResult();
        if (modifiers == null) return batch;
        for (TalentModifier modifier : modifiers) {
            if (modifier == null) continue;
            batch.add(apply(modifier, depot, params));
        }
        return batch;
    }

    /**
     * Apply a talent's open configs with the talent's own parameter list.
     */
    public BatchResult applyTalent(TalentData talent, SkillDepot depot) {
        if (talent == null) return new BatchResult();
        BatchResult batch = applyAll(talent.openConfigs(), depot, talent.paramList());
        if (batch.hasFailures()) {
            logger.warn("[talent] talent {}: {} of {} modifiers failed",
                    talent.id(), batch.getFailures().size(), batch.size());
        }
        return batch;
    }
}
