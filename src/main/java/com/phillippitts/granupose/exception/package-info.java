/**
 * Unchecked exception hierarchy for the bridge, rooted at
 * {@link com.phillippitts.granupose.exception.GranuPoseException}.
 *
 * <p>Rate-limit drops and transport-not-ready conditions are <em>not</em> exceptions: they are
 * normal send outcomes reported through result records.
 */
package com.phillippitts.granupose.exception;
