/**
 * Spring Boot auto-configuration for the mail bridge.
 *
 * <p>Configure with {@code mailbridge.*} properties and supply a
 * {@link mailbridge.DeliveryResolver} bean to deliver mail from this instance.
 *
 * @see mailbridge.spring.boot.MailBridgeProperties
 */
package mailbridge.spring.boot;
