package com.tandem.sync;

import java.time.Instant;

/**
 * A commit that a squash sync would fold in.
 */
public record CommitInfo(String sha, String author, String email, Instant timestamp, String message) {}
