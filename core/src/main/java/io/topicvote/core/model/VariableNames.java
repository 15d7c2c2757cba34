package io.topicvote.core.model;

import java.util.Set;

/**
 * Well-known variable names shared between hosts and voting code. Hosts populate them, build-in
 * votings read them, and none of them may be used as a {@code let} target.
 */
public final class VariableNames {

    public static final String EPSILON = "epsilon";
    public static final String VOCABULARY_SIZE = "n_voc";
    public static final String VOCABULARY_SIZE_TARGET = "n_voc_target";
    public static final String TOPIC_MAX_PROBABILITY = "topic_max";
    public static final String TOPIC_MIN_PROBABILITY = "topic_min";
    public static final String TOPIC_AVG_PROBABILITY = "topic_avg";
    public static final String TOPIC_SUM_PROBABILITY = "topic_sum";
    public static final String COUNT_OF_VOTERS = "ct_voters";
    public static final String NUMBER_OF_VOTERS = "n_voters";
    public static final String HAS_TRANSLATION = "has_translation";
    public static final String IS_ORIGIN_WORD = "is_origin_word";
    public static final String SCORE_CANDIDATE = "score_candidate";
    public static final String RECIPROCAL_RANK = "rr";
    public static final String RANK = "rank";
    public static final String IMPORTANCE = "importance";
    public static final String SCORE = "score";
    public static final String VOTER_ID = "voter_id";
    public static final String CANDIDATE_ID = "candidate_id";
    public static final String TOPIC_ID = "topic_id";

    private static final Set<String> RESERVED = Set.of(
            EPSILON,
            VOCABULARY_SIZE,
            VOCABULARY_SIZE_TARGET,
            TOPIC_MAX_PROBABILITY,
            TOPIC_MIN_PROBABILITY,
            TOPIC_AVG_PROBABILITY,
            TOPIC_SUM_PROBABILITY,
            COUNT_OF_VOTERS,
            NUMBER_OF_VOTERS,
            HAS_TRANSLATION,
            IS_ORIGIN_WORD,
            SCORE_CANDIDATE,
            RECIPROCAL_RANK,
            RANK,
            IMPORTANCE,
            SCORE,
            VOTER_ID,
            CANDIDATE_ID,
            TOPIC_ID);

    private VariableNames() {
        // utility class
    }

    public static boolean isReserved(String name) {
        return RESERVED.contains(name);
    }

    public static Set<String> reserved() {
        return RESERVED;
    }
}
