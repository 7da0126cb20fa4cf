/**
 * REST controllers: {@code /process}, {@code /execute_command}, {@code /generate_response},
 * {@code /health}, and the operator endpoints {@code /stats} and {@code /reload_model}.
 * Request bodies use snake_case field names.
 */
package com.phillippitts.shato.presentation.controller;
