package org.catalogsearch.ranking.model;

/**
 * One entry of a ranked result list.
 *
 * @param candidate  the candidate as supplied by the caller
 * @param rank       1-based position
 * @param finalScore weighted score the list is sorted by
 * @param breakdown  explanation of the score
 */
public record RankedCandidate(Candidate candidate, int rank, double finalScore, ScoreBreakdown breakdown) {

    public String candidateId() {
        return candidate.getId();
    }
}
