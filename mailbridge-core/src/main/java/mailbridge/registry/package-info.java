/**
 * Consumer lifecycle.
 */
package mailbridge.registry;
