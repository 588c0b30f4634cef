/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.db;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
    Indentation-based format: one node per line as key:value, children indented one space
    deeper than their parent. A value starting with "|" continues on the following, more deeply
    indented lines. A key containing ":" is wrapped in quotes, with "" standing for a literal quote.
**/
public class Schema2 extends Schema
{
    public Schema2 (int version, String type)
    {
        super (version, type);
    }

    public void read (MNode node, Reader reader) throws IOException
    {
        LineReader lr = new LineReader (reader);
        read (node, lr, lr.whitespaces);
    }

    public void read (MNode node, LineReader reader, int whitespaces) throws IOException
    {
        while (true)
        {
            if (reader.line == null) return;  // end of file

            // Split the line into key and value.
            String line = reader.line.trim ();
            StringBuilder prefix = new StringBuilder ();
            String value = null;
            boolean escape =  ! line.isEmpty ()  &&  line.charAt (0) == '"';
            int i = escape ? 1 : 0;
            int last = line.length () - 1;
            for (; i <= last; i++)
            {
                char c = line.charAt (i);
                if (escape)
                {
                    if (c == '"')
                    {
                        if (i < last  &&  line.charAt (i+1) == '"')  // doubled quote is a literal quote
                        {
                            i++;
                        }
                        else
                        {
                            escape = false;
                            continue;
                        }
                    }
                }
                else if (c == ':')
                {
                    value = line.substring (i+1).trim ();
                    break;
                }
                prefix.append (c);
            }
            String key = prefix.toString ().trim ();

            if (value != null  &&  value.startsWith ("|"))  // block of text
            {
                StringBuilder block = new StringBuilder ();
                reader.getNextLine ();
                if (reader.whitespaces > whitespaces)
                {
                    int blockIndent = reader.whitespaces;
                    while (true)
                    {
                        block.append (reader.line.substring (blockIndent));
                        reader.getNextLine ();
                        if (reader.whitespaces < blockIndent) break;
                        block.append ("\n");
                    }
                }
                value = block.toString ();
            }
            else
            {
                reader.getNextLine ();
            }
            MNode child = node.set (value, key);
            if (reader.whitespaces > whitespaces) read (child, reader, reader.whitespaces);
            if (reader.whitespaces < whitespaces) return;
        }
    }

    public void write (MNode node, Writer writer, String indent) throws IOException
    {
        String key = node.key ();
        if (key.startsWith ("\"")  ||  key.contains (":")  ||  key.isEmpty ())
        {
            key = "\"" + key.replace ("\"", "\"\"") + "\"";
        }

        if (! node.data ())
        {
            writer.write (String.format ("%s%s%n", indent, key));
        }
        else
        {
            String value = node.get ();
            String newLine = String.format ("%n");
            if (value.contains ("\n")  ||  value.startsWith ("|"))
            {
                value = value.replace ("\n", newLine + indent + " ");
                value = "|" + newLine + indent + " " + value;
            }
            writer.write (String.format ("%s%s:%s%n", indent, key, value));
        }

        String space = indent + " ";
        for (MNode c : node) write (c, writer, space);
    }

    /**
        Reads non-empty lines one at a time, and counts the leading spaces of each.
        At end of file, line is null and whitespaces is -1.
    **/
    public static class LineReader
    {
        public BufferedReader reader;
        public String         line;
        public int            whitespaces;

        public LineReader (Reader reader) throws IOException
        {
            if (reader instanceof BufferedReader) this.reader = (BufferedReader) reader;
            else                                  this.reader = new BufferedReader (reader);
            getNextLine ();
        }

        public void getNextLine () throws IOException
        {
            while (true)
            {
                line = reader.readLine ();
                if (line == null)
                {
                    whitespaces = -1;
                    return;
                }
                if (! line.trim ().isEmpty ()) break;
            }

            int length = line.length ();
            whitespaces = 0;
            while (whitespaces < length  &&  line.charAt (whitespaces) == ' ') whitespaces++;
        }
    }
}
