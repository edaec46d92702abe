/**
 * Order-preserving fuzzy alignment of derived summaries onto transcript timestamps.
 */
package com.phillippitts.livescribe.service.align;
