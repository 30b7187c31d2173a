/**
 **
 ** Pupil.java - complex field in the pupil plane
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Pupil.java is free software: you can redistribute it and/or modify
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
 * Complex field sampled on a square grid in the pupil plane.
 * <p>
 * The array is size*size with size=sampling*gamma, stored as {re,im}. The aperture
 * center is at index (0,0) (wrapped around the corners), the convention the Fourier
 * transform expects. Use {@link #getAmplitude(boolean, boolean)} with shift=true
 * for a centered view.
 * <p>
 * Pupils are immutable, every operation returns a new instance.
 */
public class Pupil {
	public static final double ARCSEC_PER_RADIAN=180.0*3600.0/Math.PI;

	private final double [][] reIm;
	private final int    size;
	private final int    sampling;   // samples across the aperture diameter of the generated pupil
	private final int    gamma;      // oversampling (zero padding) factor
	private final double sampleSize; // physical size of one pupil sample, m
	private final double diameter;   // physical aperture diameter, m
	private final SliceDescriptor slice; // slice the field came from, null if not sliced

	Pupil(double [][] reIm, int sampling, int gamma, double sampleSize, double diameter){
		this(reIm, sampling, gamma, sampleSize, diameter, null);
	}

	Pupil(double [][] reIm, int sampling, int gamma, double sampleSize, double diameter, SliceDescriptor slice){
		int size=(int) Math.round(Math.sqrt(reIm[0].length));
		if ((size*size!=reIm[0].length) || (reIm[1].length!=reIm[0].length)) {
			throw new IllegalArgumentException("Pupil field should be square, got "+reIm[0].length+" samples");
		}
		this.reIm=reIm;
		this.size=size;
		this.sampling=sampling;
		this.gamma=gamma;
		this.sampleSize=sampleSize;
		this.diameter=diameter;
		this.slice=slice;
	}

	/**
	 * Uniformly illuminated circular aperture, normalized to unit energy.
	 * @param sampling samples across the aperture diameter, power of 2
	 * @param gamma oversampling factor, the grid is sampling*gamma wide
	 * @param physicalRadius aperture radius, m
	 * @param diagnostics progress reports
	 */
	public static Pupil circular(
			int sampling,
			int gamma,
			double physicalRadius,
			SimulationDiagnostics diagnostics){
		if (!ComplexFHT.isPowerOfTwo(sampling)) {
			throw new IllegalArgumentException("Pupil sampling should be a power of two, got "+sampling);
		}
		if (gamma<1) {
			throw new IllegalArgumentException("Pupil gamma should be a positive integer, got "+gamma);
		}
		if (!(physicalRadius>0)) {
			throw new IllegalArgumentException("Pupil radius should be positive, got "+physicalRadius);
		}
		int size=sampling*gamma;
		int hsize=size/2;
		double r2=0.25*sampling*sampling; // radius in samples, squared
		double [][] reIm=new double[2][size*size];
		int inside=0;
		for (int i=0;i<size;i++) for (int j=0;j<size;j++){
			double dy=i-hsize;
			double dx=j-hsize;
			if ((dx*dx+dy*dy)<=r2) {
				reIm[0][i*size+j]=1.0;
				inside++;
			}
		}
		double norm=1.0/Math.sqrt(inside);
		for (int i=0;i<reIm[0].length;i++) reIm[0][i]*=norm;
		ComplexFHT.swapQuadrants(reIm[0]);
		double sampleSize=2*physicalRadius/sampling;
		if (diagnostics!=null) {
			diagnostics.debug(" Created circular pupil: "+size+"x"+size+" samples, "+inside+" inside the aperture, radius "+
					physicalRadius+" m, "+sampleSize+" m/sample");
		}
		return new Pupil(reIm, sampling, gamma, sampleSize, 2*physicalRadius);
	}

	/**
	 * Transform to the image plane (Fraunhofer). The result has DC in the center,
	 * plate scale wavelength/(size*sampleSize) and hfov = plate scale * size / 2.
	 * @param wavelength wavelength, m
	 * @param fht transform instance to reuse, or null
	 */
	public Image toConjugateImage(BigDecimal wavelength, ComplexFHT fht){
		if (fht==null) fht=new ComplexFHT();
		double [][] field=fht.forward(this.reIm);
		ComplexFHT.swapQuadrants(field);
		double pscale=getPlateScale(wavelength);
		return new Image(field, wavelength, pscale, this.sampling, this.gamma, this.diameter, this.slice);
	}

	public Image toConjugateImage(BigDecimal wavelength){
		return toConjugateImage(wavelength, null);
	}

	/** image plane sample size (arcsec) produced by this pupil at the wavelength */
	public double getPlateScale(BigDecimal wavelength){
		return ARCSEC_PER_RADIAN*wavelength.doubleValue()/(this.size*this.sampleSize);
	}

	/** image plane half field of view (arcsec) produced by this pupil at the wavelength */
	public double getHFOV(BigDecimal wavelength){
		return getPlateScale(wavelength)*this.size/2;
	}

	/**
	 * Adds phase (radians) to the field, amplitude is unchanged.
	 * @param phase size*size array in the same (corner) convention as this pupil
	 */
	public Pupil addToPhase(double [] phase){
		if (phase.length!=this.reIm[0].length) {
			throw new IllegalArgumentException("Phase map has "+phase.length+" samples, pupil has "+this.reIm[0].length);
		}
		double [][] result=new double [2][phase.length];
		for (int i=0;i<phase.length;i++){
			double c=Math.cos(phase[i]);
			double s=Math.sin(phase[i]);
			result[0][i]=this.reIm[0][i]*c-this.reIm[1][i]*s;
			result[1][i]=this.reIm[0][i]*s+this.reIm[1][i]*c;
		}
		return new Pupil(result, this.sampling, this.gamma, this.sampleSize, this.diameter, this.slice);
	}

	/**
	 * @param shift move the aperture center to the array center
	 * @param normalise scale maximum to 1.0
	 */
	public double [] getAmplitude(boolean shift, boolean normalise){
		double [] amp=new double[this.reIm[0].length];
		double max=0.0;
		for (int i=0;i<amp.length;i++) {
			amp[i]=Math.sqrt(this.reIm[0][i]*this.reIm[0][i]+this.reIm[1][i]*this.reIm[1][i]);
			if (amp[i]>max) max=amp[i];
		}
		if (normalise && (max>0.0)) for (int i=0;i<amp.length;i++) amp[i]/=max;
		if (shift) ComplexFHT.swapQuadrants(amp);
		return amp;
	}

	/** total energy, sum of |P|^2 */
	public double getEnergy(){
		double e=0.0;
		for (int i=0;i<this.reIm[0].length;i++) e+=this.reIm[0][i]*this.reIm[0][i]+this.reIm[1][i]*this.reIm[1][i];
		return e;
	}

	/** half of the physical grid extent, mm */
	public double getHalfExtent(){
		return 1000.0*this.sampleSize*this.size/2;
	}

	/** copy of the field */
	public double [][] getReIm(){
		return new double [][] {this.reIm[0].clone(),this.reIm[1].clone()};
	}

	public SliceDescriptor getSlice() {
		return this.slice;
	}
	public int getSize() {
		return this.size;
	}
	public int getSampling() {
		return this.sampling;
	}
	public int getGamma() {
		return this.gamma;
	}
	public double getSampleSize() {
		return this.sampleSize;
	}
	public double getDiameter() {
		return this.diameter;
	}
}
