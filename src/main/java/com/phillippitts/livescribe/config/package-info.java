/**
 * Spring configuration: bean wiring, executors and configuration properties.
 */
package com.phillippitts.livescribe.config;
