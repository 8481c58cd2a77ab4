/**
 * A <a href="https://en.wikipedia.org/wiki/Token_bucket">token bucket</a> that decides whether to admit
 * units of work, refilled by a background thread at a fixed interval.
 * <p>
 * <b>Thread safety</b>: Classes are not thread-safe unless indicated otherwise (e.g.
 * {@link com.github.cowwoc.admission.TokenBucket}).
 */
package com.github.cowwoc.admission;
