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
    Serialization format of a problem document. The first line of a file names the format,
    for example "N2A.schema=3". Everything after it is handled by the subclass selected from that line.
**/
public class Schema
{
    public int    version;
    public String type;

    public Schema (int version, String type)
    {
        this.version = version;
        this.type    = type;
    }

    public static Schema latest ()
    {
        return new Schema2 (3, "");
    }

    /**
        Reads the header and loads all the objects as children of the given node.
    **/
    public static Schema readAll (MNode node, Reader reader) throws IOException
    {
        BufferedReader br;
        if (reader instanceof BufferedReader) br =    (BufferedReader) reader;
        else                                  br = new BufferedReader (reader);
        Schema result = read (br);
        result.read (node, br);
        return result;
    }

    public static Schema read (BufferedReader reader) throws IOException
    {
        String line = reader.readLine ();
        if (line == null) throw new IOException ("File is empty.");
        line = line.trim ();
        if (! line.startsWith ("N2A.schema")) throw new IOException ("Schema line not found.");
        if (line.length () < 12) throw new IOException ("Malformed schema line.");
        if (line.charAt (10) != '=') throw new IOException ("Malformed schema line.");
        String[] pieces = line.substring (11).split (",", 2);
        int version;
        try
        {
            version = Integer.parseInt (pieces[0].trim ());
        }
        catch (NumberFormatException e)
        {
            throw new IOException ("Malformed schema version: " + pieces[0]);
        }
        String type = "";
        if (pieces.length >= 2) type = pieces[1].trim ();
        if (version < 2) throw new IOException ("Unsupported schema version " + version);
        return new Schema2 (version, type);
    }

    public void read (MNode node, Reader reader) throws IOException
    {
        throw new IOException ("Must use specific schema to read file.");
    }

    /**
        Writes the header and all the children of the given node.
        The node itself acts only as a container.
    **/
    public void writeAll (MNode node, Writer writer) throws IOException
    {
        writer.write ("N2A.schema=" + version);
        if (! type.isEmpty ()) writer.write ("," + type);
        writer.write (String.format ("%n"));
        for (MNode c : node) write (c, writer, "");
    }

    public void write (MNode node, Writer writer, String indent) throws IOException
    {
        throw new IOException ("Must use specific schema to write file.");
    }
}
