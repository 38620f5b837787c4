package com.opro.optimization.model;

import java.util.List;

/**
 * Proposer reply after validation at the client boundary.
 */
public interface ProposalReply {

    record Texts(List<String> texts) implements ProposalReply {
    }

    record ParseError(String reason, String raw) implements ProposalReply {
    }

    record EmptyResponse() implements ProposalReply {
    }
}
