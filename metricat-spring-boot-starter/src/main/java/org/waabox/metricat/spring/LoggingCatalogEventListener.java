package org.waabox.metricat.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.metricat.event.CatalogEvent;
import org.waabox.metricat.event.CatalogEventCodec;
import org.waabox.metricat.event.CatalogEventListener;

/**
 * Logs every catalog change as a JSON line. Registered when
 * {@code metricat.log-events} is true.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class LoggingCatalogEventListener implements CatalogEventListener {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      LoggingCatalogEventListener.class);

  /** {@inheritDoc} */
  @Override
  public void onEvent(final CatalogEvent event) {
    if (log.isInfoEnabled()) {
      log.info("Catalog '{}' changed: {}", event.catalogName(),
          CatalogEventCodec.serialize(event));
    }
  }
}
