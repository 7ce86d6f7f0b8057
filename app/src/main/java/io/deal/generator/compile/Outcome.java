package io.deal.generator.compile;

import com.google.protobuf.Descriptors.Descriptor;
import io.deal.generator.contract.ErrorCode;
import io.deal.generator.resolve.ResolvedMessage;

/**
 * What a matched (or unmatched) call answers.
 */
public sealed interface Outcome {

    /** Success case: answer with the resolved response and no error. */
    record Respond(ResolvedMessage response) implements Outcome {
    }

    /** Failure case: fail with the status code and literal description, no response. */
    record Fail(ErrorCode code, String message) implements Outcome {
        public String errorText() {
            return code.errorText(message);
        }
    }

    /**
     * No case matched: answer with the default instance of the output type and no error.
     * An unmatched call is indistinguishable from a contract case answering an empty message.
     */
    record Fallback(Descriptor outputType) implements Outcome {
    }
}
