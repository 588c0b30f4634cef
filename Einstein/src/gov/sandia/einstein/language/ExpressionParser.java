/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.einstein.language;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.einstein.eqset.Equality;
import gov.sandia.einstein.language.function.PlainFunction;
import gov.sandia.einstein.language.operator.Add;
import gov.sandia.einstein.language.operator.Multiply;
import gov.sandia.einstein.language.operator.Negate;
import gov.sandia.einstein.language.operator.Power;

/**
    Recursive-descent parser for equations written in index notation.
    <pre>
    equation   := "Eq" "(" expression "," expression ")"  |  expression "=" expression
    expression := product (("+" | "-") product)*
    product    := unary (("*" | "/") unary)*
    unary      := "-" unary | power
    power      := primary (("**" | "^") unary)?
    primary    := number | name | name "(" arguments ")" | "(" expression ")"
    </pre>
    Subtraction is stored as addition of a negation, and division as multiplication by a power of -1.
**/
public class ExpressionParser
{
    protected String      line;
    protected SymbolTable symbols;
    protected int         position;    // of next character to examine
    protected int         tokenStart;  // for error reports

    public ExpressionParser (String line, SymbolTable symbols)
    {
        this.line    = line;
        this.symbols = symbols;
    }

    public static Equality parse (String line, SymbolTable symbols) throws ParseException
    {
        ExpressionParser parser = new ExpressionParser (line, symbols);
        Equality result = parser.equation ();
        parser.expectEnd ();
        return result;
    }

    public static Operator parseExpression (String line, SymbolTable symbols) throws ParseException
    {
        ExpressionParser parser = new ExpressionParser (line, symbols);
        Operator result = parser.expression ();
        parser.expectEnd ();
        return result;
    }

    public Equality equation () throws ParseException
    {
        skipWhitespace ();
        int start = position;
        if (line.startsWith ("Eq", position))
        {
            position += 2;
            skipWhitespace ();
            if (peek () == '(')
            {
                position++;
                Operator lhs = expression ();
                expect (',');
                Operator rhs = expression ();
                expect (')');
                return new Equality (lhs, rhs);
            }
            position = start;
        }

        Operator lhs = expression ();
        expect ('=');
        Operator rhs = expression ();
        return new Equality (lhs, rhs);
    }

    public Operator expression () throws ParseException
    {
        List<Operator> addends = new ArrayList<Operator> ();
        addends.add (product ());
        while (true)
        {
            skipWhitespace ();
            char c = peek ();
            if      (c == '+') {position++; addends.add (product ());}
            else if (c == '-') {position++; addends.add (new Negate (product ()));}
            else break;
        }
        if (addends.size () == 1) return addends.get (0);
        return new Add (addends);
    }

    public Operator product () throws ParseException
    {
        List<Operator> factors = new ArrayList<Operator> ();
        factors.add (unary ());
        while (true)
        {
            skipWhitespace ();
            char c = peek ();
            if (c == '*'  &&  peek (1) != '*')
            {
                position++;
                factors.add (unary ());
            }
            else if (c == '/')
            {
                position++;
                factors.add (new Power (unary (), new Constant (-1)));
            }
            else break;
        }
        if (factors.size () == 1) return factors.get (0);
        return new Multiply (factors);
    }

    public Operator unary () throws ParseException
    {
        skipWhitespace ();
        if (peek () == '-')
        {
            position++;
            return new Negate (unary ());
        }
        return power ();
    }

    public Operator power () throws ParseException
    {
        Operator base = primary ();
        skipWhitespace ();
        if (peek () == '^')
        {
            position++;
            return new Power (base, unary ());
        }
        if (peek () == '*'  &&  peek (1) == '*')
        {
            position += 2;
            return new Power (base, unary ());
        }
        return base;
    }

    public Operator primary () throws ParseException
    {
        skipWhitespace ();
        tokenStart = position;
        char c = peek ();
        if (c == 0) throw error ("Unexpected end of expression");
        if (c == '(')
        {
            position++;
            Operator result = expression ();
            expect (')');
            return result;
        }
        if (Character.isDigit (c)  ||  c == '.') return number ();
        if (Character.isLetter (c))
        {
            String name = identifier ();
            int nameStart = tokenStart;
            skipWhitespace ();
            if (peek () == '(') return function (name, nameStart);
            try
            {
                return Term.fromName (name, symbols);
            }
            catch (ParseException e)
            {
                throw new ParseException (e.getMessage (), line, nameStart);
            }
        }
        throw error ("Unexpected character '" + c + "'");
    }

    protected Operator number () throws ParseException
    {
        int start = position;
        while (Character.isDigit (peek ())) position++;
        if (peek () == '.')
        {
            position++;
            while (Character.isDigit (peek ())) position++;
        }
        char c = peek ();
        if (c == 'e'  ||  c == 'E')
        {
            int save = position;
            position++;
            if (peek () == '+'  ||  peek () == '-') position++;
            if (Character.isDigit (peek ())) while (Character.isDigit (peek ())) position++;
            else                             position = save;  // Not an exponent after all.
        }
        String text = line.substring (start, position);
        try
        {
            return new Constant (Double.parseDouble (text));
        }
        catch (NumberFormatException e)
        {
            throw new ParseException ("Malformed number: " + text, line, start);
        }
    }

    protected String identifier ()
    {
        int start = position;
        while (true)
        {
            char c = peek ();
            if (! Character.isLetterOrDigit (c)  &&  c != '_') break;
            position++;
        }
        return line.substring (start, position);
    }

    protected Operator function (String name, int nameStart) throws ParseException
    {
        if (name.equals ("Eq")) throw new ParseException ("Eq() may only enclose an entire equation", line, nameStart);

        expect ('(');
        List<Operator> arguments = new ArrayList<Operator> ();
        skipWhitespace ();
        if (peek () == ')')
        {
            position++;
        }
        else
        {
            while (true)
            {
                arguments.add (expression ());
                skipWhitespace ();
                if (peek () == ',')
                {
                    position++;
                    continue;
                }
                expect (')');
                break;
            }
        }

        Function result;
        Operator.Factory factory = Operator.operators.get (name);
        if (factory == null) result = new PlainFunction (name);
        else                 result = (Function) factory.createInstance ();

        int count = arguments.size ();
        int required = result.arguments ();
        if (required >= 0  &&  count != required) throw new ParseException (name + "() requires " + required + " arguments but has " + count, line, nameStart);
        if (count < result.minimumArguments ()) throw new ParseException (name + "() requires at least " + result.minimumArguments () + " arguments but has " + count, line, nameStart);

        Function.Kind kind = result.kind ();
        if (kind == Function.Kind.KRONECKER_DELTA  ||  kind == Function.Kind.LEVI_CIVITA)
        {
            // Arguments are bare index symbols rather than terms.
            for (int i = 0; i < count; i++)
            {
                Operator a = arguments.get (i);
                if (! (a instanceof Term)  ||  ((Term) a).isIndexed ()) throw new ParseException (name + "() arguments must be index symbols", line, nameStart);
                arguments.set (i, new Index (((Term) a).name));
            }
        }
        result.operands = arguments.toArray (new Operator[count]);
        return result;
    }

    protected void expect (char c) throws ParseException
    {
        skipWhitespace ();
        if (peek () != c)
        {
            tokenStart = position;
            if (peek () == 0) throw error ("Expected '" + c + "' but reached end of expression");
            throw error ("Expected '" + c + "' but found '" + peek () + "'");
        }
        position++;
    }

    protected void expectEnd () throws ParseException
    {
        skipWhitespace ();
        if (position < line.length ())
        {
            tokenStart = position;
            throw error ("Unexpected text after end of expression");
        }
    }

    protected void skipWhitespace ()
    {
        while (position < line.length ()  &&  Character.isWhitespace (line.charAt (position))) position++;
    }

    protected char peek ()
    {
        return peek (0);
    }

    /**
        @return The character at the given offset from the current position, or 0 if past the end of the line.
    **/
    protected char peek (int offset)
    {
        int i = position + offset;
        if (i >= line.length ()) return 0;
        return line.charAt (i);
    }

    protected ParseException error (String message)
    {
        return new ParseException (message, line, tokenStart);
    }
}
