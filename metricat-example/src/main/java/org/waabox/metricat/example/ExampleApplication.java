package org.waabox.metricat.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot application entry point for the metric catalog example
 * service.
 *
 * <p>This application demonstrates how to use the metric catalog with
 * Spring Boot, including:
 * <ul>
 *   <li>registering the metrics of a loaded collector plugin at
 *       startup</li>
 *   <li>logging every catalog change as JSON</li>
 *   <li>REST API for listing and describing the registered metrics</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class ExampleApplication {

  /** Launches the Spring Boot application.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    SpringApplication.run(ExampleApplication.class, args);
  }
}
