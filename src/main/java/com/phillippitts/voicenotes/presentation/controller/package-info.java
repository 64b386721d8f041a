/**
 * REST controllers: recording submission, the failed-recording queue, and API key settings.
 */
package com.phillippitts.voicenotes.presentation.controller;
