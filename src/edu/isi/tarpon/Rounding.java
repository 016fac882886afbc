package edu.isi.tarpon;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
/**
 * Rounding.java - 
 *   uses text formatting to round doubles to a specified number
 *   of decimal places for reports.
 */
public class Rounding {

    // reports are read by scripts, so the decimal point never follows the locale
    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.US);

    /**
     * Always print exactly places decimal places, never scientific.
     *
     * @param val the value to be rounded.
     * @param places the number of decimal places to keep.
     * @return string version of val with places decimal places.
     */
    public static String fixed(double val, int places) {
	StringBuffer p = new StringBuffer(places > 0 ? "0." : "0");
	for (int i = 0; i < places; i++)
	    p.append('0');
	return new DecimalFormat(p.toString(), SYMBOLS).format(val);
    }
}
