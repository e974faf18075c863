/**
 * Data model: job rows and states, and the bug report, project and archive records the
 * retention lifecycle operates on.
 *
 * @see bugtrail.model.JobRecord
 * @see bugtrail.model.JobState
 * @see bugtrail.model.BugReport
 */
package bugtrail.model;
