/**
 **
 ** Image.java - complex field in the image plane
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Image.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

import java.math.BigDecimal;

/**
 * Complex field sampled on a square grid in the image plane, Fourier conjugate of a {@link Pupil}.
 * <p>
 * DC (the on-axis field point) is at index (size/2,size/2), sample (i,j) is at
 * ((j-size/2)*pscale, (i-size/2)*pscale) arcsec. Images are immutable; resampling and
 * slicing return new instances.
 */
public class Image {
	public static final double AIRY_DIAMETER=2.44; // in lambda/D

	private final double [][] reIm;
	private final int        size;
	private final BigDecimal wavelength; // m
	private final double     pscale;     // arcsec per sample
	private final int        sampling;   // of the pupil this image was derived from
	private final int        gamma;
	private final double     diameter;   // physical aperture diameter, m
	private final SliceDescriptor slice; // null if not sliced

	Image(double [][] reIm, BigDecimal wavelength, double pscale, int sampling, int gamma, double diameter, SliceDescriptor slice){
		int size=(int) Math.round(Math.sqrt(reIm[0].length));
		if ((size*size!=reIm[0].length) || (reIm[1].length!=reIm[0].length)) {
			throw new IllegalArgumentException("Image field should be square, got "+reIm[0].length+" samples");
		}
		this.reIm=reIm;
		this.size=size;
		this.wavelength=wavelength;
		this.pscale=pscale;
		this.sampling=sampling;
		this.gamma=gamma;
		this.diameter=diameter;
		this.slice=slice;
	}

	/** same plane parameters, different field */
	Image withField(double [][] field, SliceDescriptor slice){
		return new Image(field, this.wavelength, this.pscale, this.sampling, this.gamma, this.diameter, slice);
	}

	/**
	 * Inverse transform to the pupil plane, DC moved back to the corner. The pupil sample size is
	 * recovered from the plate scale so that the pupil transforms back to this image.
	 * @param fht transform instance to reuse, or null
	 */
	public Pupil toConjugatePupil(ComplexFHT fht){
		if (fht==null) fht=new ComplexFHT();
		double [][] field=getReIm();
		ComplexFHT.swapQuadrants(field);
		double [][] pupilField=fht.inverse(field);
		double sampleSize=this.wavelength.doubleValue()/(this.size*this.pscale/Pupil.ARCSEC_PER_RADIAN);
		return new Pupil(pupilField, this.sampling, this.gamma, sampleSize, this.diameter, this.slice);
	}

	public Pupil toConjugatePupil(){
		return toConjugatePupil(null);
	}

	/**
	 * Regrid onto a symmetric square grid with a different plate scale and extent.
	 * @param targetPscale output plate scale, arcsec
	 * @param targetHfov output half field of view, arcsec
	 * @param resampler spline resampler
	 */
	public Image resample(double targetPscale, double targetHfov, Resampler resampler){
		int outSize=Resampler.getOutputSize(targetPscale, targetHfov);
		double [][] field=resampler.resample2d(
				this.reIm,
				-getHFOV(),
				this.pscale,
				-targetHfov,
				targetPscale,
				outSize);
		return new Image(field, this.wavelength, targetPscale, this.sampling, this.gamma, this.diameter, this.slice);
	}

	public double getHFOV(){
		return this.pscale*this.size/2;
	}

	/** lambda/D, arcsec */
	public double getResolutionElement(){
		return Pupil.ARCSEC_PER_RADIAN*this.wavelength.doubleValue()/this.diameter;
	}

	/** first dark ring diameter, arcsec */
	public double getAiryDiameter(){
		return AIRY_DIAMETER*getResolutionElement();
	}

	public double [] getAmplitude(boolean normalise){
		double [] amp=getIntensity();
		double max=0.0;
		for (int i=0;i<amp.length;i++) {
			amp[i]=Math.sqrt(amp[i]);
			if (amp[i]>max) max=amp[i];
		}
		if (normalise && (max>0.0)) for (int i=0;i<amp.length;i++) amp[i]/=max;
		return amp;
	}

	/** |E|^2 */
	public double [] getIntensity(){
		double [] intensity=new double[this.reIm[0].length];
		for (int i=0;i<intensity.length;i++) intensity[i]=this.reIm[0][i]*this.reIm[0][i]+this.reIm[1][i]*this.reIm[1][i];
		return intensity;
	}

	public double getEnergy(){
		double e=0.0;
		for (double d:getIntensity()) e+=d;
		return e;
	}

	/**
	 * Central part of the amplitude, nDiameters Airy diameters across (limited by the array size).
	 * Used for plots.
	 */
	public Plane getAmplitudeScaledByAiryDiameters(double nDiameters, boolean normalise){
		int hsize=this.size/2;
		int halfWidth=(int) Math.ceil(0.5*nDiameters*getAiryDiameter()/this.pscale);
		if ((halfWidth<1) || (halfWidth>hsize)) halfWidth=hsize;
		int width=2*halfWidth;
		double [] amp=getAmplitude(normalise);
		double [] crop=new double[width*width];
		for (int i=0;i<width;i++) for (int j=0;j<width;j++){
			crop[i*width+j]=amp[(i+hsize-halfWidth)*this.size+(j+hsize-halfWidth)];
		}
		return new Plane(crop, width, halfWidth*this.pscale);
	}

	/** copy of the field */
	public double [][] getReIm(){
		return new double [][] {this.reIm[0].clone(),this.reIm[1].clone()};
	}

	public int getSize() {
		return this.size;
	}
	public BigDecimal getWavelength() {
		return this.wavelength;
	}
	public double getPlateScale() {
		return this.pscale;
	}
	public int getSampling() {
		return this.sampling;
	}
	public int getGamma() {
		return this.gamma;
	}
	public double getDiameter() {
		return this.diameter;
	}
	public SliceDescriptor getSlice() {
		return this.slice;
	}
	/** slice number, 0 for an unsliced image */
	public int getSliceNumber() {
		return (this.slice==null)?0:this.slice.getSliceNumber();
	}

	/** square real plane with its half extent */
	public static class Plane {
		public final double [] pixels;
		public final int       width;
		public final double    halfExtent;
		public Plane(double [] pixels, int width, double halfExtent){
			this.pixels=pixels;
			this.width=width;
			this.halfExtent=halfExtent;
		}
	}
}
