/**
 * FITS adapters (nom-tam-fits): reduced echelle cube input and merged 1-D spectrum output.
 */
package org.cerespp.infrastructure.fits;
