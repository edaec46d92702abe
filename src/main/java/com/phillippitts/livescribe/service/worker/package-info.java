/**
 * Live recognition worker: bounded queues, output filters and real-time factor tracking.
 */
package com.phillippitts.livescribe.service.worker;
