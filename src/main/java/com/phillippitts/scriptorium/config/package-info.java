/**
 * Spring configuration: typed properties, startup validation, executors and the logging filter.
 */
package com.phillippitts.scriptorium.config;
