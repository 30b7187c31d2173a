/**
 **
 ** CameraModel.java - camera focal ratio and physical scale conversions
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CameraModel.java is free software: you can redistribute it and/or modify
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

/**
 * Spectrograph camera, used to convert the detector pixel pitch into the physical pupil size
 * and image plate scales into detector pixels.
 * Lengths are in meters.
 */
public class CameraModel {
	public final double wfno; // working f-number
	public final double effl; // effective focal length

	public CameraModel(double wfno, double effl){
		if (!(effl>0)) throw new IllegalArgumentException("Camera focal length should be positive, got "+effl);
		this.wfno=wfno;
		this.effl=effl;
	}

	/** focal ratio that samples referenceWavelength at Nyquist with pixels of pixelPitch */
	public static double getNyquistFocalRatio(double pixelPitch, double referenceWavelength){
		return (2*pixelPitch)/referenceWavelength;
	}

	/** pupil diameter that makes the camera Nyquist-sample referenceWavelength on the detector */
	public double getPupilPhysicalDiameter(double pixelPitch, double referenceWavelength){
		return this.effl/getNyquistFocalRatio(pixelPitch, referenceWavelength);
	}

	public double getPupilPhysicalRadius(double pixelPitch, double referenceWavelength){
		return getPupilPhysicalDiameter(pixelPitch, referenceWavelength)/2;
	}

	/** pupil diameter implied by the nominal working f-number */
	public double getNominalPupilDiameter(){
		return this.effl/this.wfno;
	}

	/** detector pixels covered by one image sample of the given plate scale (arcsec) */
	public double getDetectorPixelsPerSample(double pscale, double pixelPitch){
		return (pscale/Pupil.ARCSEC_PER_RADIAN)*this.effl/pixelPitch;
	}
}
