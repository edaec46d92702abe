/**
 * External process plumbing shared by the decode source and the process-backed providers.
 *
 * <p>{@link com.phillippitts.livescribe.service.process.ProcessFactory} is the test seam;
 * {@link com.phillippitts.livescribe.service.process.ProcessRunner} runs one-shot tools and
 * {@link com.phillippitts.livescribe.service.process.ProcessTerminator} implements the
 * terminate, wait, kill sequence.
 */
package com.phillippitts.livescribe.service.process;
