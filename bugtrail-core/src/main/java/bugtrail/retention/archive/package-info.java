/**
 * Storage archive strategies used when reports leave primary storage.
 */
package bugtrail.retention.archive;
