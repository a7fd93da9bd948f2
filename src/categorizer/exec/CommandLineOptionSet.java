package categorizer.exec;

import java.util.*;
import categorizer.tree.PrintTools;

public class CommandLineOptionSet
{
  public final int UTILITY = 1;
  public final int CONSTRUCTION = 2;
  public final int OUTPUT = 3;

  private class OptionRecord
  {
    public int option_type;
    public String value;
    public String arg;
    public String usage;

    public OptionRecord(int type, String value, String arg, String usage)
    {
      this.option_type = type;
      this.value = value;
      this.arg = arg;
      this.usage = usage;
    }
  }

  private TreeMap<String, OptionRecord> name_to_record;

  public CommandLineOptionSet()
  {
    name_to_record = new TreeMap<String, OptionRecord>();
  }

  public void add(int type, String name, String usage)
  {
    name_to_record.put(name, new OptionRecord(type, null, null, usage));
  }

  public void add(int type, String name, String arg, String usage)
  {
    name_to_record.put(name, new OptionRecord(type, null, arg, usage));
  }

  public void add(int type, String name, String value, String arg, String usage)
  {
    name_to_record.put(name, new OptionRecord(type, value, arg, usage));
  }

  public boolean contains(String name)
  {
    return name_to_record.containsKey(name);
  }

  public String getUsage()
  {
    StringBuilder sb = new StringBuilder(4000);
    String sep = PrintTools.line_sep;
    appendSection(sb, "UTILITY", UTILITY, sep);
    appendSection(sb, "CONSTRUCTION", CONSTRUCTION, sep);
    appendSection(sb, "OUTPUT", OUTPUT, sep);
    return sb.toString();
  }

  private void appendSection(StringBuilder sb, String title, int type, String sep)
  {
    for (int i = 0; i < 80; i++) sb.append("-");
    sb.append(sep).append(title).append(sep);
    for (int i = 0; i < 80; i++) sb.append("-");
    sb.append(sep).append(getUsage(type));
  }

  public String getUsage(int type)
  {
    StringBuilder sb = new StringBuilder(1000);
    for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
      OptionRecord record = entry.getValue();

      if (record.option_type == type) {
        sb.append("-").append(entry.getKey());
        if (record.arg != null) {
          sb.append("=").append(record.arg);
        }
        sb.append("\n    ");
        sb.append(record.usage);
        sb.append("\n\n");
      }
    }
    return sb.toString();
  }

  public String getValue(String name)
  {
    OptionRecord record = name_to_record.get(name);

    if (record == null)
      return null;
    else
      return record.value;
  }

  public void setValue(String name, String value)
  {
    OptionRecord record = name_to_record.get(name);

    if (record != null)
      record.value = value;
  }

  public int getType(String name)
  {
    OptionRecord record = name_to_record.get(name);

    if (record == null)
      return 0;
    else
      return record.option_type;
  }
}
