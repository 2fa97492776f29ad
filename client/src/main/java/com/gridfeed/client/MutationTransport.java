package com.gridfeed.client;

import com.gridfeed.core.envelope.Envelope;

import java.io.IOException;

/**
 * Delivers one envelope to the model service and hands back whatever it answered.
 */
@FunctionalInterface
public interface MutationTransport {
    MutationResponse send(Envelope envelope) throws IOException, InterruptedException;
}
