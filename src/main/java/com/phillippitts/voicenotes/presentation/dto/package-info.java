/**
 * Request and response bodies of the REST boundary.
 */
package com.phillippitts.voicenotes.presentation.dto;
