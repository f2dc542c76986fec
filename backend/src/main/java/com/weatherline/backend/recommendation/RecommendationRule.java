package com.weatherline.backend.recommendation;

/**
 * One step of the recommendation fold.
 *
 * @param <A> what the rule derives from the request before touching the recommendation
 */
public interface RecommendationRule<A> {

    String name();

    A assess(RecommendationRequest request);

    /**
     * Returns the recommendation with this rule applied. Never lowers the alert level.
     */
    Recommendation apply(Recommendation current, A assessment, RecommendationRequest request);

    default Recommendation evaluate(Recommendation current, RecommendationRequest request) {
        return apply(current, assess(request), request);
    }
}
