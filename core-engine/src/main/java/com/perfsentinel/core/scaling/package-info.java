/**
 * Capacity recommendations from windowed metric statistics.
 */
package com.perfsentinel.core.scaling;
