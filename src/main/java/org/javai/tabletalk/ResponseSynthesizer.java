package org.javai.tabletalk;

import org.javai.tabletalk.resolve.ResolutionPlan;

/**
 * Final rewrite of a tool's output before it reaches the user.
 */
@FunctionalInterface
public interface ResponseSynthesizer {

	/**
	 * Tool output is already readable text, so the default hands it back untouched.
	 */
	ResponseSynthesizer PASS_THROUGH = (query, plan, toolOutput) -> toolOutput;

	String synthesize(String query, ResolutionPlan plan, String toolOutput);
}
