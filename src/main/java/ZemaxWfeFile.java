/**
 **
 ** ZemaxWfeFile.java - parser for Zemax wavefront map text listings
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ZemaxWfeFile.java is free software: you can redistribute it and/or modify
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

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads "Wavefront Map" listings exported by Zemax. The listing is UTF-16LE with a byte order
 * mark as Zemax writes it, plain ASCII/UTF-8 is accepted too.
 * <pre>
 * 0.6563 µm at 0.0000, 0.0000 (deg).
 * Peak to valley = 0.1234 waves, RMS = 0.0123 waves.
 * Pupil grid size: 64 by 64
 * Center point is: 33, 33
 * Wavefront values in waves.
 *
 *  1.23450E-002  1.23460E-002 ...
 * </pre>
 * Values are converted from waves to radians.
 */
public class ZemaxWfeFile {
	private static final Pattern WAVE_LINE=Pattern.compile(
			"^\\s*([-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?)\\s*(nm|um|\u00b5m|\u03bcm|mm|m)\\s+at\\s+"+
			"([-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?)\\s*,\\s*([-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?)\\s*\\(([^)]*)\\)");
	private static final Pattern GRID_LINE=Pattern.compile("Pupil grid size:\\s*(\\d+)\\s*by\\s*(\\d+)",Pattern.CASE_INSENSITIVE);
	private static final Pattern VALUES_LINE=Pattern.compile("Wavefront values in\\s+(\\w+)",Pattern.CASE_INSENSITIVE);

	private final File path;
	private final SimulationDiagnostics diagnostics;
	private List<String> lines=null;
	private int dataStart=-1; // first line after the header
	private Header header=null;

	public static class Header {
		public final BigDecimal wave;
		public final BigDecimal waveExp;
		public final int        sampling;
		public final double []  field;
		public final String     fieldUnits;
		public Header(BigDecimal wave, BigDecimal waveExp, int sampling, double [] field, String fieldUnits){
			this.wave=wave;
			this.waveExp=waveExp;
			this.sampling=sampling;
			this.field=field;
			this.fieldUnits=fieldUnits;
		}
		public BigDecimal getWavelength(){
			return this.wave.multiply(this.waveExp);
		}
	}

	public ZemaxWfeFile(File path, SimulationDiagnostics diagnostics){
		this.path=path;
		this.diagnostics=diagnostics;
	}

	public File getPath(){
		return this.path;
	}

	/** m per listed wavelength unit, null for an unknown unit */
	public static BigDecimal getWaveExponent(String unit){
		if ("nm".equals(unit)) return new BigDecimal("1E-9");
		if ("um".equals(unit) || "\u00b5m".equals(unit) || "\u03bcm".equals(unit)) return new BigDecimal("1E-6");
		if ("mm".equals(unit)) return new BigDecimal("1E-3");
		if ("m".equals(unit))  return BigDecimal.ONE;
		return null;
	}

	/**
	 * Reads and checks the header.
	 * @return false if the file can not be read or is not a wavefront map listing
	 */
	public boolean parseFileHeader(){
		this.header=null;
		try {
			readLines();
		} catch (IOException e){
			if (this.diagnostics!=null) this.diagnostics.debug(" Can not read "+this.path+": "+e.getMessage());
			return false;
		}
		BigDecimal wave=null;
		BigDecimal waveExp=null;
		double [] field=null;
		String fieldUnits=null;
		int sampling=-1;
		boolean inWaves=false;
		for (int n=0;n<this.lines.size();n++){
			String line=this.lines.get(n);
			Matcher m;
			if ((wave==null) && (m=WAVE_LINE.matcher(line)).find()){
				wave=new BigDecimal(m.group(1));
				waveExp=getWaveExponent(m.group(2));
				field=new double[] {Double.parseDouble(m.group(3)),Double.parseDouble(m.group(4))};
				fieldUnits=m.group(5).trim();
				continue;
			}
			if ((m=GRID_LINE.matcher(line)).find()){
				int sx=Integer.parseInt(m.group(1));
				int sy=Integer.parseInt(m.group(2));
				if (sx!=sy) {
					if (this.diagnostics!=null) this.diagnostics.debug(" Non-square pupil grid ("+sx+" by "+sy+") in "+this.path);
					return false;
				}
				sampling=sx;
				continue;
			}
			if ((m=VALUES_LINE.matcher(line)).find()){
				inWaves="waves".equalsIgnoreCase(m.group(1));
				this.dataStart=n+1;
				break;
			}
		}
		if ((wave==null) || (waveExp==null) || (sampling<1) || !inWaves) return false;
		this.header=new Header(wave, waveExp, sampling, field, fieldUnits);
		return true;
	}

	/** header found by {@link #parseFileHeader()}, null if not parsed or invalid */
	public Header getHeader(){
		return this.header;
	}

	/**
	 * Reads the complete map
	 * @return phase map in radians
	 * @throws IOException if the file is not a wavefront map or the data is incomplete
	 */
	public WfeMap parse() throws IOException {
		if ((this.header==null) && !parseFileHeader()) {
			throw new IOException(this.path+" is not a Zemax wavefront map listing");
		}
		int sampling=this.header.sampling;
		double [] phase=new double[sampling*sampling];
		int index=0;
		for (int n=this.dataStart;(n<this.lines.size()) && (index<phase.length);n++){
			String line=this.lines.get(n).trim();
			if (line.length()==0) continue;
			for (String token:line.split("\\s+")){
				if (index>=phase.length) break;
				try {
					phase[index++]=2*Math.PI*Double.parseDouble(token);
				} catch (NumberFormatException e){
					throw new IOException("Bad value \""+token+"\" in line "+(n+1)+" of "+this.path, e);
				}
			}
		}
		if (index<phase.length) {
			throw new IOException("Truncated wavefront map "+this.path+": got "+index+" of "+phase.length+" values");
		}
		if (this.diagnostics!=null) this.diagnostics.debug(" Read "+sampling+"x"+sampling+" WFE map ("+
				this.header.getWavelength().toPlainString()+" m, field "+this.header.field[0]+", "+this.header.field[1]+") from "+this.path);
		return new WfeMap(this.header.wave, this.header.waveExp, sampling, this.header.field, phase);
	}

	private void readLines() throws IOException {
		if (this.lines!=null) return;
		byte [] bytes=readBytes(this.path);
		Charset charset=detectCharset(bytes);
		List<String> result=new ArrayList<String>();
		BufferedReader reader=new BufferedReader(new InputStreamReader(new ByteArrayInputStream(bytes), charset));
		try {
			String line;
			boolean first=true;
			while ((line=reader.readLine())!=null){
				if (first && (line.length()>0) && (line.charAt(0)=='\uFEFF')) line=line.substring(1);
				first=false;
				result.add(line);
			}
		} finally {
			reader.close();
		}
		this.lines=result;
	}

	static Charset detectCharset(byte [] bytes){
		if ((bytes.length>=2) && ((bytes[0]&0xff)==0xff) && ((bytes[1]&0xff)==0xfe)) return Charset.forName("UTF-16LE");
		if ((bytes.length>=2) && ((bytes[0]&0xff)==0xfe) && ((bytes[1]&0xff)==0xff)) return Charset.forName("UTF-16BE");
		// UTF-16LE without BOM: ASCII text has every odd byte zero
		if ((bytes.length>=4) && (bytes[0]!=0) && (bytes[1]==0) && (bytes[3]==0)) return Charset.forName("UTF-16LE");
		return Charset.forName("UTF-8");
	}

	private static byte [] readBytes(File file) throws IOException {
		InputStream is=new FileInputStream(file);
		try {
			long len=file.length();
			if (len>Integer.MAX_VALUE) throw new IOException("File "+file+" is too large");
			byte [] buf=new byte[(int) len];
			int off=0;
			while (off<buf.length){
				int n=is.read(buf, off, buf.length-off);
				if (n<0) break;
				off+=n;
			}
			if (off<buf.length) {
				byte [] shorter=new byte[off];
				System.arraycopy(buf, 0, shorter, 0, off);
				return shorter;
			}
			return buf;
		} finally {
			is.close();
		}
	}
}
