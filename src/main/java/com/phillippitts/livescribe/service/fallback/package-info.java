/**
 * File transcription fallback: provider tiers tried in preference order, each returning a tagged
 * {@link com.phillippitts.livescribe.service.fallback.ProviderResult} instead of throwing.
 */
package com.phillippitts.livescribe.service.fallback;
