package com.rms.fanout.core.model;

/**
 * =====================================================================
 * CacheManagerState
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Lifecycle of the in-process event cache.
 *
 * STATE MACHINE
 * -------------
 *
 *   STOPPED ──start()──▶ STARTING ──tasks launched──▶ RUNNING
 *      ▲                                                 │
 *      └──────────── tasks cancelled ◀── STOPPING ◀──stop()
 *
 * Only RUNNING reports healthy. Subscriptions may be served in any
 * state; they simply see an empty cache before backfill has run.
 */
public enum CacheManagerState {

    /** Initial and terminal state. No background task is running. */
    STOPPED,

    /**
     * Backfill, notification listener, consumer and sweep are being
     * launched.
     */
    STARTING,

    /** Steady state: ingesting and serving subscriptions. */
    RUNNING,

    /**
     * Background tasks are being cancelled in reverse launch order and
     * the notification subscription is being released.
     */
    STOPPING
}
