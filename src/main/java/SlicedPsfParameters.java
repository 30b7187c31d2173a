/**
 **
 ** SlicedPsfParameters.java - parameters of the sliced PSF simulation
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SlicedPsfParameters.java is free software: you can redistribute it and/or modify
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

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;

import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.HierarchicalConfiguration;
import org.apache.commons.configuration.XMLConfiguration;

/**
 * Simulation parameters. Read from an XML file with sections general, pupil, slicing, output
 * and wfe, can be stored in Properties with a key prefix.
 * <pre>
 * &lt;slicedPsf&gt;
 *   &lt;debugLevel&gt;1&lt;/debugLevel&gt;
 *   &lt;general&gt;&lt;nSlices&gt;5&lt;/nSlices&gt;...&lt;/general&gt;
 *   &lt;pupil&gt;&lt;sampling&gt;256&lt;/sampling&gt;&lt;gamma&gt;4&lt;/gamma&gt;...&lt;/pupil&gt;
 *   &lt;wfe&gt;&lt;file&gt;&lt;path&gt;...&lt;/path&gt;&lt;wave&gt;8E-7&lt;/wave&gt;&lt;fieldX&gt;0&lt;/fieldX&gt;&lt;fieldY&gt;0&lt;/fieldY&gt;&lt;/file&gt;&lt;/wfe&gt;
 * &lt;/slicedPsf&gt;
 * </pre>
 */
public class SlicedPsfParameters {
	public static final String ROOT_ELEMENT="slicedPsf";

	public int debugLevel=1;
	public int threadsMax=1;
	public GeneralParameters general=new GeneralParameters();
	public PupilParameters   pupil=  new PupilParameters();
	public SlicingParameters slicing=new SlicingParameters();
	public OutputParameters  output= new OutputParameters();
	public WfeParameters     wfe=    new WfeParameters();

	public static class GeneralParameters {
		public double     detectorPixelPitch=15E-6; // m
		public boolean    doWfe=false;
		public double     cameraWfno=3.0;
		public double     cameraEffl=0.24; // m
		public int        nSlices=5;
		public BigDecimal wavelengthStart=   new BigDecimal("1000E-9");
		public BigDecimal wavelengthEnd=     new BigDecimal("1000E-9");
		public BigDecimal wavelengthInterval=new BigDecimal("10E-9");

		public void setProperties(String prefix,Properties properties){
			properties.setProperty(prefix+"detectorPixelPitch",this.detectorPixelPitch+"");
			properties.setProperty(prefix+"doWfe",this.doWfe+"");
			properties.setProperty(prefix+"cameraWfno",this.cameraWfno+"");
			properties.setProperty(prefix+"cameraEffl",this.cameraEffl+"");
			properties.setProperty(prefix+"nSlices",this.nSlices+"");
			properties.setProperty(prefix+"wavelengthStart",this.wavelengthStart.toString());
			properties.setProperty(prefix+"wavelengthEnd",this.wavelengthEnd.toString());
			properties.setProperty(prefix+"wavelengthInterval",this.wavelengthInterval.toString());
		}
		public void getProperties(String prefix,Properties properties){
			if (properties.getProperty(prefix+"detectorPixelPitch")!=null) this.detectorPixelPitch=Double.parseDouble(properties.getProperty(prefix+"detectorPixelPitch"));
			if (properties.getProperty(prefix+"doWfe")!=null) this.doWfe=parseBoolean(properties.getProperty(prefix+"doWfe"));
			if (properties.getProperty(prefix+"cameraWfno")!=null) this.cameraWfno=Double.parseDouble(properties.getProperty(prefix+"cameraWfno"));
			if (properties.getProperty(prefix+"cameraEffl")!=null) this.cameraEffl=Double.parseDouble(properties.getProperty(prefix+"cameraEffl"));
			if (properties.getProperty(prefix+"nSlices")!=null) this.nSlices=Integer.parseInt(properties.getProperty(prefix+"nSlices").trim());
			if (properties.getProperty(prefix+"wavelengthStart")!=null) this.wavelengthStart=new BigDecimal(properties.getProperty(prefix+"wavelengthStart").trim());
			if (properties.getProperty(prefix+"wavelengthEnd")!=null) this.wavelengthEnd=new BigDecimal(properties.getProperty(prefix+"wavelengthEnd").trim());
			if (properties.getProperty(prefix+"wavelengthInterval")!=null) this.wavelengthInterval=new BigDecimal(properties.getProperty(prefix+"wavelengthInterval").trim());
		}
	}

	public static class PupilParameters {
		public String     sampling="256"; // kept as text, validated to be an integer
		public String     gamma="4";
		public double     referenceWavelength=1000E-9; // m
		public BigDecimal resampleTo=new BigDecimal("1000E-9");

		public void setProperties(String prefix,Properties properties){
			properties.setProperty(prefix+"sampling",this.sampling);
			properties.setProperty(prefix+"gamma",this.gamma);
			properties.setProperty(prefix+"referenceWavelength",this.referenceWavelength+"");
			properties.setProperty(prefix+"resampleTo",this.resampleTo.toString());
		}
		public void getProperties(String prefix,Properties properties){
			if (properties.getProperty(prefix+"sampling")!=null) this.sampling=properties.getProperty(prefix+"sampling").trim();
			if (properties.getProperty(prefix+"gamma")!=null) this.gamma=properties.getProperty(prefix+"gamma").trim();
			if (properties.getProperty(prefix+"referenceWavelength")!=null) this.referenceWavelength=Double.parseDouble(properties.getProperty(prefix+"referenceWavelength"));
			if (properties.getProperty(prefix+"resampleTo")!=null) this.resampleTo=new BigDecimal(properties.getProperty(prefix+"resampleTo").trim());
		}
		/** integer sampling, null if it is not an integer */
		public Integer getSampling(){
			return parseInteger(this.sampling);
		}
		/** integer gamma, null if it is not an integer */
		public Integer getGamma(){
			return parseInteger(this.gamma);
		}
	}

	public static class SlicingParameters {
		public double width=1.0; // resolution elements of the reference wavelength

		public void setProperties(String prefix,Properties properties){
			properties.setProperty(prefix+"width",this.width+"");
		}
		public void getProperties(String prefix,Properties properties){
			if (properties.getProperty(prefix+"width")!=null) this.width=Double.parseDouble(properties.getProperty(prefix+"width"));
		}
	}

	public static class OutputParameters {
		public double resamplingFactor=1.0;
		public double hfov=1.0; // arcsec
		public String filename="cube.fits";

		public void setProperties(String prefix,Properties properties){
			properties.setProperty(prefix+"resamplingFactor",this.resamplingFactor+"");
			properties.setProperty(prefix+"hfov",this.hfov+"");
			properties.setProperty(prefix+"filename",this.filename);
		}
		public void getProperties(String prefix,Properties properties){
			if (properties.getProperty(prefix+"resamplingFactor")!=null) this.resamplingFactor=Double.parseDouble(properties.getProperty(prefix+"resamplingFactor"));
			if (properties.getProperty(prefix+"hfov")!=null) this.hfov=Double.parseDouble(properties.getProperty(prefix+"hfov"));
			if (properties.getProperty(prefix+"filename")!=null) this.filename=properties.getProperty(prefix+"filename");
		}
	}

	public static class WfeParameters {
		public String directory="";
		public String prefix="";
		public List<WfeCatalogue.Entry> files=new ArrayList<WfeCatalogue.Entry>(); // explicit list, used instead of the directory scan

		public void setProperties(String prefix,Properties properties){
			properties.setProperty(prefix+"directory",this.directory);
			properties.setProperty(prefix+"prefix",this.prefix);
			properties.setProperty(prefix+"files_length",this.files.size()+"");
			for (int i=0;i<this.files.size();i++){
				WfeCatalogue.Entry entry=this.files.get(i);
				properties.setProperty(prefix+"files_"+i+"_path",entry.path.getPath());
				properties.setProperty(prefix+"files_"+i+"_wave",entry.wavelength.toString());
				properties.setProperty(prefix+"files_"+i+"_fieldX",entry.field[0]+"");
				properties.setProperty(prefix+"files_"+i+"_fieldY",entry.field[1]+"");
			}
		}
		public void getProperties(String prefix,Properties properties){
			if (properties.getProperty(prefix+"directory")!=null) this.directory=properties.getProperty(prefix+"directory");
			if (properties.getProperty(prefix+"prefix")!=null) this.prefix=properties.getProperty(prefix+"prefix");
			if (properties.getProperty(prefix+"files_length")!=null) {
				int n=Integer.parseInt(properties.getProperty(prefix+"files_length"));
				this.files=new ArrayList<WfeCatalogue.Entry>();
				for (int i=0;i<n;i++){
					this.files.add(new WfeCatalogue.Entry(
							new File(properties.getProperty(prefix+"files_"+i+"_path")),
							new BigDecimal(properties.getProperty(prefix+"files_"+i+"_wave").trim()),
							new double[] {
									Double.parseDouble(properties.getProperty(prefix+"files_"+i+"_fieldX","0")),
									Double.parseDouble(properties.getProperty(prefix+"files_"+i+"_fieldY","0"))}));
				}
			}
		}
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"debugLevel",this.debugLevel+"");
		properties.setProperty(prefix+"threadsMax",this.threadsMax+"");
		this.general.setProperties(prefix+"general.", properties);
		this.pupil.setProperties(prefix+"pupil.", properties);
		this.slicing.setProperties(prefix+"slicing.", properties);
		this.output.setProperties(prefix+"output.", properties);
		this.wfe.setProperties(prefix+"wfe.", properties);
	}

	public void getProperties(String prefix,Properties properties){
		if (properties.getProperty(prefix+"debugLevel")!=null) this.debugLevel=Integer.parseInt(properties.getProperty(prefix+"debugLevel").trim());
		if (properties.getProperty(prefix+"threadsMax")!=null) this.threadsMax=Integer.parseInt(properties.getProperty(prefix+"threadsMax").trim());
		this.general.getProperties(prefix+"general.", properties);
		this.pupil.getProperties(prefix+"pupil.", properties);
		this.slicing.getProperties(prefix+"slicing.", properties);
		this.output.getProperties(prefix+"output.", properties);
		this.wfe.getProperties(prefix+"wfe.", properties);
	}

	/**
	 * Reads parameters from an XML file, missing keys keep their current values
	 * @param pathname XML file path
	 * @throws ConfigurationException if the file can not be read or parsed
	 */
	public void loadFromXML(String pathname) throws ConfigurationException {
		XMLConfiguration hConfig=new XMLConfiguration();
		hConfig.setDelimiterParsingDisabled(true);
		hConfig.load(pathname);
		Properties properties=new Properties();
		for (Iterator<String> iter=hConfig.getKeys(); iter.hasNext();){
			String key=iter.next();
			if (key.startsWith("wfe.file.") || key.equals("wfe.file")) continue;
			properties.setProperty(key, hConfig.getString(key));
		}
		try {
			getProperties("", properties);
		} catch (NumberFormatException e){
			throw new ConfigurationException("Bad number in "+pathname+": "+e.getMessage(), e);
		}
		int num=hConfig.getMaxIndex("wfe.file")+1;
		if (num>0) {
			this.wfe.files=new ArrayList<WfeCatalogue.Entry>();
			for (int i=0;i<num;i++){
				HierarchicalConfiguration sub = hConfig.configurationAt("wfe.file("+i+")");
				String path=sub.getString("path");
				String wave=sub.getString("wave");
				if ((path==null) || (wave==null)) {
					throw new ConfigurationException("WFE file entry "+i+" in "+pathname+" needs both path and wave");
				}
				File file=new File(path);
				if (!file.isAbsolute() && (this.wfe.directory.length()>0)) file=new File(this.wfe.directory, path);
				try {
					this.wfe.files.add(new WfeCatalogue.Entry(
							file,
							new BigDecimal(wave.trim()),
							new double[] {Double.parseDouble(sub.getString("fieldX","0")),Double.parseDouble(sub.getString("fieldY","0"))}));
				} catch (NumberFormatException e){
					throw new ConfigurationException("Bad number in WFE file entry "+i+" in "+pathname+": "+e.getMessage(), e);
				}
			}
		}
	}

	/**
	 * Writes parameters to an XML file readable by {@link #loadFromXML(String)}
	 * @throws IOException if the file can not be written
	 */
	public void saveToXML(String pathname) throws IOException {
		XMLConfiguration hConfig=new XMLConfiguration();
		hConfig.setDelimiterParsingDisabled(true);
		hConfig.setRootElementName(ROOT_ELEMENT);
		Properties properties=new Properties();
		setProperties("", properties);
		for (String key:new TreeSet<String>(properties.stringPropertyNames())){
			if (key.startsWith("wfe.files_")) continue;
			hConfig.addProperty(key, properties.getProperty(key));
		}
		for (WfeCatalogue.Entry entry:this.wfe.files){
			hConfig.addProperty("wfe.file(-1).path",entry.path.getPath());
			hConfig.addProperty("wfe.file.wave",entry.wavelength.toString());
			hConfig.addProperty("wfe.file.fieldX",entry.field[0]);
			hConfig.addProperty("wfe.file.fieldY",entry.field[1]);
		}
		BufferedWriter writer=new BufferedWriter(new FileWriter(new File(pathname)));
		try {
			hConfig.save(writer);
		} catch (ConfigurationException e) {
			throw new IOException("Failed to write "+pathname+": "+e.getMessage(), e);
		} finally {
			writer.close();
		}
	}

	/** simulated wavelengths: start, start+interval, ... up to and including end, m */
	public List<BigDecimal> getWavelengths(){
		if (this.general.wavelengthInterval.signum()<=0) {
			throw new IllegalArgumentException("Wavelength interval should be positive, got "+this.general.wavelengthInterval);
		}
		List<BigDecimal> waves=new ArrayList<BigDecimal>();
		for (BigDecimal w=this.general.wavelengthStart; w.compareTo(this.general.wavelengthEnd)<=0; w=w.add(this.general.wavelengthInterval)){
			waves.add(w);
		}
		return waves;
	}

	public CameraModel getCameraModel(){
		return new CameraModel(this.general.cameraWfno, this.general.cameraEffl);
	}

	/** radius of the simulated pupil, m */
	public double getPupilPhysicalRadius(){
		return getCameraModel().getPupilPhysicalRadius(this.general.detectorPixelPitch, this.pupil.referenceWavelength);
	}

	/** integer value of the text ("256" or "256.0"), null if it is not an integer */
	public static Integer parseInteger(String s){
		if (s==null) return null;
		try {
			BigDecimal d=new BigDecimal(s.trim());
			return d.intValueExact();
		} catch (NumberFormatException e){
			return null;
		} catch (ArithmeticException e){
			return null;
		}
	}

	static boolean parseBoolean(String s){
		s=s.trim();
		return "1".equals(s) || Boolean.parseBoolean(s);
	}
}
