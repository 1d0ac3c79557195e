package org.waabox.metricat.event;

/**
 * A listener that is notified when the keys of a metric catalog change.
 *
 * <p>Listeners are called on the thread that performed the change, after the
 * catalog lock has been released. An exception thrown by a listener is
 * logged and does not undo the change.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface CatalogEventListener {

  /**
   * Called after the catalog changed.
   *
   * @param event the change, never null
   */
  void onEvent(CatalogEvent event);
}
