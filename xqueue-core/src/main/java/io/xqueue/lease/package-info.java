/**
 * Lease selection: which submission a worker may take next.
 *
 * <p>{@link io.xqueue.lease.LeaseCriteria} holds the eligibility predicate shared by the push
 * and pull paths; {@link io.xqueue.lease.LeaseSelector} applies FIFO ordering. Stores make the
 * selection atomic with the lease write.
 */
package io.xqueue.lease;
