/**
 **
 ** WfeMap.java - wavefront error map for one wavelength and field
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WfeMap.java is free software: you can redistribute it and/or modify
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
 * Wavefront error map: phase in radians on a SAMPLING x SAMPLING grid, centered.
 */
public class WfeMap {
	public final BigDecimal wave;     // wavelength mantissa, as listed
	public final BigDecimal waveExp;  // wavelength unit, m
	public final int        sampling;
	public final double []  field;    // field position {x,y}
	private final double [] phase;    // radians, row-major, sampling*sampling

	public WfeMap(BigDecimal wave, BigDecimal waveExp, int sampling, double [] field, double [] phase){
		if (phase.length!=sampling*sampling) {
			throw new IllegalArgumentException("WFE map should have "+(sampling*sampling)+" samples, got "+phase.length);
		}
		this.wave=wave;
		this.waveExp=waveExp;
		this.sampling=sampling;
		this.field=field.clone();
		this.phase=phase;
	}

	/** exact wavelength, m */
	public BigDecimal getWavelength(){
		return this.wave.multiply(this.waveExp);
	}

	/** copy of the phase map, radians */
	public double [] getPhase(){
		return this.phase.clone();
	}

	/**
	 * Places the map in the center of a zero array of the pupil size and moves its center to
	 * (0,0), so it can be added to the pupil phase directly.
	 * @param pupil pupil to match
	 * @return pupil.getSize()^2 phase array, radians
	 */
	public double [] getPaddedPhase(Pupil pupil){
		int size=pupil.getSize();
		if (this.sampling>size) {
			throw new IllegalArgumentException("WFE map ("+this.sampling+"x"+this.sampling+") does not fit in the pupil ("+size+"x"+size+")");
		}
		double [] padded=new double[size*size];
		int offset=size/2-this.sampling/2;
		for (int i=0;i<this.sampling;i++){
			System.arraycopy(this.phase, i*this.sampling, padded, (i+offset)*size+offset, this.sampling);
		}
		ComplexFHT.swapQuadrants(padded);
		return padded;
	}

	/** centered padded phase for display */
	public double [] getPaddedPhaseCentered(Pupil pupil){
		double [] padded=getPaddedPhase(pupil);
		ComplexFHT.swapQuadrants(padded);
		return padded;
	}

	@Override
	public String toString(){
		return "WfeMap["+getWavelength().toPlainString()+" m, field "+this.field[0]+", "+this.field[1]+", "+this.sampling+"x"+this.sampling+"]";
	}
}
