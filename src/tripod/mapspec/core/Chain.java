package tripod.mapspec.core;

import java.io.*;
import java.util.*;
import java.util.logging.Logger;

import org.apache.commons.math.stat.descriptive.DescriptiveStatistics;

/**
 * Record of a sampling run: one row of (-2 ln likelihood, parameters)
 * per state. The columns are fixed by the first record (or by the
 * constructor) and every later record must carry the same names in the
 * same order.
 */
public class Chain implements Serializable {
    private static final long serialVersionUID = 0x29cf5a81e3b70d64l;
    private static final Logger logger =
        Logger.getLogger(Chain.class.getName());

    public static final String HEADER = "# lnlikely";
    static final String SEPARATOR = "   ";

    /**
     * Marginal distribution of one parameter
     */
    public static class Summary {
        final String name;
        final int count;
        final double lower; // 16th percentile
        final double median;
        final double upper; // 84th percentile
        final double mean;
        final double stddev;

        Summary (String name, double[] values) {
            DescriptiveStatistics stats = new DescriptiveStatistics ();
            for (double v : values)
                stats.addValue(v);
            this.name = name;
            this.count = values.length;
            double[] sorted = stats.getSortedValues();
            this.lower = percentile (sorted, 16.);
            this.median = percentile (sorted, 50.);
            this.upper = percentile (sorted, 84.);
            this.mean = stats.getMean();
            this.stddev = stats.getStandardDeviation();
        }

        /**
         * Linear interpolation between the closest ranks, at position
         * (n - 1) p / 100 of the sorted values.
         */
        static double percentile (double[] sorted, double p) {
            if (sorted.length == 0)
                return Double.NaN;
            double pos = (sorted.length - 1) * p / 100.;
            int lo = (int)Math.floor(pos);
            if (lo >= sorted.length - 1)
                return sorted[sorted.length - 1];
            double frac = pos - lo;
            return sorted[lo] + frac * (sorted[lo + 1] - sorted[lo]);
        }

        public String getName () { return name; }
        public int getCount () { return count; }
        public double getLower () { return lower; }
        public double getMedian () { return median; }
        public double getUpper () { return upper; }
        public double getMean () { return mean; }
        public double getStandardDeviation () { return stddev; }

        public String toString () {
            return "Summary{"+name+": n="+count
                +",16%="+String.format("%1$.5f", lower)
                +",50%="+String.format("%1$.5f", median)
                +",84%="+String.format("%1$.5f", upper)
                +",mean="+String.format("%1$.5f", mean)
                +",std="+String.format("%1$.5f", stddev)+"}";
        }
    }

    private String[] columns;
    private Map<String, Integer> index = new LinkedHashMap<String, Integer>();
    private List<Double> lnlikely = new ArrayList<Double>();
    private List<double[]> rows = new ArrayList<double[]>();

    public Chain () {
    }

    public Chain (String... columns) {
        setColumns (columns);
    }

    private void setColumns (String[] names) {
        columns = names.clone();
        for (int i = 0; i < columns.length; ++i) {
            if (index.put(columns[i], i) != null) {
                throw new IllegalArgumentException
                    ("Duplicate column \""+columns[i]+"\"");
            }
        }
    }

    public void add (Parameters p, double lnlike) {
        add (p.names(), p.toArray(), lnlike);
    }

    public void add (String[] names, double[] values, double lnlike) {
        if (names.length != values.length) {
            throw new IllegalArgumentException
                (names.length+" names for "+values.length+" values");
        }

        if (columns == null)
            setColumns (names);
        else if (!Arrays.equals(columns, names))
            throw new ChainSchemaException (columns, names);

        lnlikely.add(lnlike);
        rows.add(values.clone());
    }

    public int size () { return rows.size(); }
    public boolean isEmpty () { return rows.isEmpty(); }

    public String[] getColumns () {
        return columns != null ? columns.clone() : new String[0];
    }

    /**
     * Parameter name to column
     */
    public Map<String, Integer> getIndex () {
        return Collections.unmodifiableMap(index);
    }

    public double getLnLikely (int i) { return lnlikely.get(i); }
    public double[] getRow (int i) { return rows.get(i).clone(); }

    public double[] getLnLikely () {
        double[] v = new double[lnlikely.size()];
        for (int i = 0; i < v.length; ++i)
            v[i] = lnlikely.get(i);
        return v;
    }

    public double[] getColumn (String name) {
        Integer c = index.get(name);
        if (c == null) {
            throw new IllegalArgumentException
                ("Chain has no parameter \""+name+"\"");
        }
        double[] v = new double[rows.size()];
        for (int i = 0; i < v.length; ++i)
            v[i] = rows.get(i)[c];
        return v;
    }

    /**
     * New chain without the first fraction of the records.
     */
    public Chain burn (double fraction) {
        if (fraction < 0. || fraction >= 1.) {
            throw new IllegalArgumentException
                ("Burn fraction must be in [0,1); got "+fraction);
        }
        Chain c = new Chain (getColumns ());
        for (int i = (int)(fraction*size ()); i < size (); ++i) {
            c.lnlikely.add(lnlikely.get(i));
            c.rows.add(rows.get(i));
        }
        return c;
    }

    public Summary getSummary (String name) {
        return new Summary (name, getColumn (name));
    }

    public Summary getSummary (String name, double burn) {
        Chain c = burn (burn);
        if (c.isEmpty()) {
            throw new IllegalStateException
                ("No records left in chain after burning "+burn);
        }
        return c.getSummary(name);
    }

    /**
     * Write the chain as text: a header line naming the columns
     * followed by one whitespace separated row per record.
     */
    public void write (OutputStream os) throws IOException {
        PrintStream ps = new PrintStream (os, false, "UTF-8");
        StringBuilder head = new StringBuilder (HEADER + SEPARATOR);
        for (String c : getColumns ())
            head.append(c + SEPARATOR);
        ps.println(head);

        for (int i = 0; i < rows.size(); ++i) {
            StringBuilder sb = new StringBuilder (format (lnlikely.get(i)));
            for (double v : rows.get(i))
                sb.append(" "+format (v));
            ps.println(sb);
        }
        ps.flush();
        if (ps.checkError())
            throw new IOException ("Can't write chain");
    }

    static String format (double v) {
        return String.format(Locale.US, "%1$.18e", v);
    }

    public static Chain read (InputStream is) throws IOException {
        BufferedReader br = new BufferedReader
            (new InputStreamReader (is, "UTF-8"));
        String line = br.readLine();
        String[] tokens = line != null && line.startsWith("#")
            ? line.substring(1).trim().split("\\s+") : null;
        if (tokens == null || !"lnlikely".equals(tokens[0])) {
            throw new IOException
                ("Not a chain file; header must begin with \""+HEADER+"\"");
        }

        Chain chain = new Chain
            (Arrays.copyOfRange(tokens, 1, tokens.length));
        int lines = 1;
        for (; (line = br.readLine()) != null; ++lines) {
            line = line.trim();
            if (line.length() == 0 || line.startsWith("#"))
                continue;

            tokens = line.split("\\s+");
            if (tokens.length != chain.columns.length + 1) {
                throw new IOException
                    ("Line "+(lines+1)+": expecting "
                     +(chain.columns.length+1)+" values; got "
                     +tokens.length);
            }
            try {
                double[] row = new double[chain.columns.length];
                for (int i = 0; i < row.length; ++i)
                    row[i] = Double.parseDouble(tokens[i+1]);
                chain.lnlikely.add(Double.parseDouble(tokens[0]));
                chain.rows.add(row);
            }
            catch (NumberFormatException ex) {
                throw new IOException
                    ("Line "+(lines+1)+": "+ex.getMessage(), ex);
            }
        }
        logger.fine("Read chain of "+chain.size()+" records "
                    +Arrays.toString(chain.columns));

        return chain;
    }

    public String toString () {
        return "Chain{columns="+Arrays.toString(getColumns ())
            +",size="+size()+"}";
    }
}
