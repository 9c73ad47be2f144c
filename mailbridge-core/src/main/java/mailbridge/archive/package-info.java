/**
 * Access to the mail archive.
 */
package mailbridge.archive;
