/**
 * Outbound notifications: channels, the drivers that deliver to them and
 * the channel store.
 *
 * <p>
 * A failed delivery is reported as a {@link com.alertrelay.pipeline.notify.SendResult}
 * value so that one broken channel never stops delivery to the others.
 * </p>
 */
package com.alertrelay.pipeline.notify;
