/**
 * Notification fan-out.
 * <p><strong>Role:</strong> {@link io.qzss.dcragent.application.dispatch.NotificationDispatcher} applies each
 * channel's {@link io.qzss.dcragent.application.dispatch.DeliveryPolicy} and isolates delivery failures. Mail
 * composition and the separator rendering used by the file and console channels live here as well.</p>
 */
package io.qzss.dcragent.application.dispatch;
