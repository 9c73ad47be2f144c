/**
 * Domain records: {@link mailbridge.model.Mail}, {@link mailbridge.model.Attachment},
 * {@link mailbridge.model.Consumer} and {@link mailbridge.model.Dispatch}.
 */
package mailbridge.model;
