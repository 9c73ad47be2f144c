/**
 * Mail ingestion and recipient selection.
 */
package mailbridge.ingest;
