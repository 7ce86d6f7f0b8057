package io.deal.generator.compile;

import io.deal.generator.resolve.ResolvedMessage;

/**
 * One contract case as a match condition and the outcome it answers.
 *
 * @param description case description from the contract
 * @param request the request a call must equal to select this entry
 * @param outcome a {@link Outcome.Respond} or {@link Outcome.Fail}
 */
public record DispatchEntry(
    String description,
    ResolvedMessage request,
    Outcome outcome
) {
    public boolean isSuccess() {
        return outcome instanceof Outcome.Respond;
    }

    public boolean isFailure() {
        return outcome instanceof Outcome.Fail;
    }

    /**
     * @throws IllegalStateException if this is a failure entry
     */
    public ResolvedMessage response() {
        if (outcome instanceof Outcome.Respond respond) {
            return respond.response();
        }
        throw new IllegalStateException("Case '" + description + "' does not answer a response");
    }

    /**
     * @throws IllegalStateException if this is a success entry
     */
    public Outcome.Fail failure() {
        if (outcome instanceof Outcome.Fail fail) {
            return fail;
        }
        throw new IllegalStateException("Case '" + description + "' does not answer an error");
    }
}
