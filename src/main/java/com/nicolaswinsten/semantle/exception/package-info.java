/**
 * Engine exception hierarchy. Each type maps to one stable client-facing error code.
 */
package com.nicolaswinsten.semantle.exception;
