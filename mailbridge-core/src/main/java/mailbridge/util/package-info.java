/**
 * Internal helpers.
 */
package mailbridge.util;
