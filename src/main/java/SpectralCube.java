/**
 **
 ** SpectralCube.java - wavelength stack of the sliced PSF intensity planes
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SpectralCube.java is free software: you can redistribute it and/or modify
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
 * Stack of intensity planes, one per simulated wavelength, in wavelength index order.
 * Planes can be appended in order ({@link #addImage(CompositeImage)}) or placed in explicit
 * slots ({@link #setImage(int, CompositeImage)}) when wavelengths complete out of order.
 * The final resample/crop is allowed once, after every plane is present.
 */
public class SpectralCube {
	private final int          nWaves;
	private final double [][]  planes;
	private final BigDecimal[] wavelengths;
	private int     width;
	private double  pscale;   // arcsec per sample
	private int     nextIndex=0;
	private int     filled=0;
	private boolean resampled=false;
	private final SimulationDiagnostics diagnostics;

	/**
	 * @param nWaves number of wavelength planes
	 * @param width plane width, samples
	 * @param pscale plate scale of every plane, arcsec
	 * @param diagnostics progress reports, may be null
	 */
	public SpectralCube(int nWaves, int width, double pscale, SimulationDiagnostics diagnostics){
		if (nWaves<1) throw new IllegalArgumentException("Cube needs at least one wavelength, got "+nWaves);
		if (width<1)  throw new IllegalArgumentException("Cube plane width should be positive, got "+width);
		this.nWaves=nWaves;
		this.width=width;
		this.pscale=pscale;
		this.planes=new double [nWaves][];
		this.wavelengths=new BigDecimal[nWaves];
		this.diagnostics=diagnostics;
	}

	/** appends the composite image as the next plane */
	public synchronized void addImage(CompositeImage image){
		while ((this.nextIndex<this.nWaves) && (this.planes[this.nextIndex]!=null)) this.nextIndex++;
		if (this.nextIndex>=this.nWaves) {
			throw new IllegalStateException("Cube already has all "+this.nWaves+" planes");
		}
		setImage(this.nextIndex, image);
	}

	/** places the composite image into the plane of the given wavelength index */
	public synchronized void setImage(int index, CompositeImage image){
		if (this.resampled) {
			throw new IllegalStateException("Cube was already resampled, no more planes can be added");
		}
		if ((index<0) || (index>=this.nWaves)) {
			throw new IndexOutOfBoundsException("Plane index "+index+" is outside of 0.."+(this.nWaves-1));
		}
		if (this.planes[index]!=null) {
			throw new IllegalStateException("Plane "+index+" is already set");
		}
		if (!image.isFinalized()) {
			throw new IllegalArgumentException("Composite image for "+image.getWavelength()+" m has "+image.getNumberOfSlices()+
					" of "+image.getExpectedSlices()+" slices");
		}
		if (image.getSize()!=this.width) {
			throw new IllegalArgumentException("Composite image is "+image.getSize()+"x"+image.getSize()+", cube planes are "+this.width+"x"+this.width);
		}
		if (Math.abs(image.getPlateScale()-this.pscale)>1E-9*this.pscale) {
			throw new IllegalArgumentException("Composite image plate scale "+image.getPlateScale()+" does not match cube plate scale "+this.pscale);
		}
		image.seal();
		this.planes[index]=image.getIntensity();
		this.wavelengths[index]=image.getWavelength();
		this.filled++;
		if (this.diagnostics!=null) this.diagnostics.debug(" Added plane "+(index+1)+" of "+this.nWaves+" ("+image.getWavelength()+" m) to the cube");
	}

	public synchronized boolean isComplete(){
		return this.filled==this.nWaves;
	}

	/**
	 * Regrids every plane to plate scale pscale*factor and crops it to +/-targetHfov.
	 * @param factor plate scale multiplier (>1 - coarser sampling)
	 * @param targetHfov output half field of view, arcsec
	 * @param resampler spline resampler
	 */
	public synchronized void resampleAndCrop(double factor, double targetHfov, Resampler resampler){
		if (!isComplete()) {
			throw new IllegalStateException("Cube has "+this.filled+" of "+this.nWaves+" planes, resample after all wavelengths are added");
		}
		if (this.resampled) {
			throw new IllegalStateException("Cube was already resampled");
		}
		if (!(factor>0)) throw new IllegalArgumentException("Resampling factor should be positive, got "+factor);
		double newPscale=this.pscale*factor;
		int outSize=Resampler.getOutputSize(newPscale, targetHfov);
		for (int n=0;n<this.nWaves;n++){
			this.planes[n]=resampler.resample2d(
					this.planes[n],
					this.width,
					-getHFOV(),
					this.pscale,
					-targetHfov,
					newPscale,
					outSize);
		}
		if (this.diagnostics!=null) this.diagnostics.debug(" Resampled cube from "+this.width+"x"+this.width+" ("+this.pscale+"\"/sample) to "+
				outSize+"x"+outSize+" ("+newPscale+"\"/sample)");
		this.width=outSize;
		this.pscale=newPscale;
		this.resampled=true;
	}

	public synchronized boolean isResampled(){
		return this.resampled;
	}

	/** copy of the plane, null if not set yet */
	public synchronized double [] getPlane(int index){
		return (this.planes[index]==null)?null:this.planes[index].clone();
	}

	public synchronized BigDecimal getWavelength(int index){
		return this.wavelengths[index];
	}

	public int getNumberOfWavelengths(){
		return this.nWaves;
	}

	public synchronized int getNumberOfPlanes(){
		return this.filled;
	}

	public synchronized int getWidth(){
		return this.width;
	}

	public synchronized double getPlateScale(){
		return this.pscale;
	}

	public synchronized double getHFOV(){
		return this.pscale*this.width/2;
	}
}
