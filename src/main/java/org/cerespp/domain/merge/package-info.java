/**
 * Inverse-variance merging of rest-frame echelle orders into a single 1-D spectrum.
 */
package org.cerespp.domain.merge;
