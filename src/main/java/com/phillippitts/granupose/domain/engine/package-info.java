/**
 * Value types describing the supervised engine: lifecycle status, state snapshots,
 * operation results and captured log lines.
 */
package com.phillippitts.granupose.domain.engine;
