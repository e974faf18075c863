/**
 * Durable job queues: enqueue, claim, outcome reporting, pause/resume, metrics and
 * housekeeping of finished jobs.
 *
 * @see bugtrail.queue.JobQueue
 */
package bugtrail.queue;
