/**
 * The boundary between dante-link and the code that speaks the Dante control protocol to individual devices,
 * along with the settings those devices accept.
 */
package org.deepsymmetry.dantelink.control;
