package io.tracedb.kernel;

/**
 * Tagged operand of a filter predicate.
 */
public sealed interface SqlValue permits SqlValue.LongValue, SqlValue.DoubleValue,
        SqlValue.StringValue, SqlValue.NullValue {

    enum Type {
        LONG,
        DOUBLE,
        STRING,
        NULL
    }

    Type type();

    static SqlValue ofLong(long value) {
        return new LongValue(value);
    }

    static SqlValue ofDouble(double value) {
        return new DoubleValue(value);
    }

    static SqlValue ofString(String value) {
        return new StringValue(value);
    }

    static SqlValue ofNull() {
        return NullValue.INSTANCE;
    }

    default boolean isNull() {
        return type() == Type.NULL;
    }

    record LongValue(long value) implements SqlValue {
        @Override
        public Type type() {
            return Type.LONG;
        }
    }

    record DoubleValue(double value) implements SqlValue {
        @Override
        public Type type() {
            return Type.DOUBLE;
        }
    }

    record StringValue(String value) implements SqlValue {
        public StringValue {
            if (value == null) {
                throw new IllegalArgumentException("value required");
            }
        }

        @Override
        public Type type() {
            return Type.STRING;
        }
    }

    record NullValue() implements SqlValue {
        static final NullValue INSTANCE = new NullValue();

        @Override
        public Type type() {
            return Type.NULL;
        }
    }
}
