/**
 * REST boundary error mapping.
 */
package com.phillippitts.granupose.presentation.exception;
