/**
 * Session orchestration for live streams and whole files.
 */
package com.phillippitts.livescribe.service.session;
