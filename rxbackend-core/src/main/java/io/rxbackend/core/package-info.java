/**
 * Generic callback-to-stream adapter.
 *
 * <p>Every vendor operation is turned into an RxJava {@code Observable} by one of four shapes:
 * <ul>
 *   <li>{@link io.rxbackend.core.CallbackObservables#single} for a call with one completion callback</li>
 *   <li>{@link io.rxbackend.core.CallbackObservables#listener} for a registration that fires until removed</li>
 *   <li>{@link io.rxbackend.core.CallbackObservables#once} for a registration the SDK detaches after one event</li>
 *   <li>{@link io.rxbackend.core.StorageTaskObservables#transferEvents} for a task reporting progress and a terminal status</li>
 * </ul>
 *
 * <p>Nothing here schedules work or owns threads. Vendor callbacks are forwarded on the thread the SDK
 * calls them on.
 */
package io.rxbackend.core;
