package com.gridfeed.core.batch;

import com.gridfeed.core.envelope.Envelope;

/**
 * An envelope and the name it is reported and persisted under.
 */
public record BatchItem(String name, Envelope envelope) {}
