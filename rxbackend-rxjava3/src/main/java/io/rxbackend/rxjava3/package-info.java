/**
 * RxJava 3 streams for every backend SDK operation.
 *
 * <p>Single-shot calls are exposed as {@code Single}, {@code Maybe} or {@code Completable}; listeners
 * as {@code Observable}. Every stream is cold and starts its vendor call on subscription. Failures are
 * the SDK's own errors.
 */
package io.rxbackend.rxjava3;
