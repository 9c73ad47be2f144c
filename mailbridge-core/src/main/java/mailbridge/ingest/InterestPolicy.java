package mailbridge.ingest;

import mailbridge.model.Consumer;
import mailbridge.model.Mail;

/**
 * Decides which consumers a newly ingested mail is dispatched to.
 */
@FunctionalInterface
public interface InterestPolicy {

  boolean isInterested(Consumer consumer, Mail mail);

  /**
   * Every consumer receives every mail.
   */
  InterestPolicy ALL = (consumer, mail) -> true;
}
