package com.jpexs.flowchart;

import com.jpexs.flowchart.source.PythonSourceReader;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Example programs for the flowchart builder.
 *
 * @author JPEXS
 */
public class Examples {

    private static final Map<String, String> EXAMPLES = new LinkedHashMap<>();

    static {
        EXAMPLES.put("ATM Machine (If/Else)",
            "def atm_withdrawal(balance: float, request: float, is_authenticated: bool) -> str:\n" +
            "    if not is_authenticated:\n" +
            "        return \"Authentication failed.\"\n" +
            "\n" +
            "    if request <= 0:\n" +
            "        print(\"Invalid amount.\")\n" +
            "        result = \"Error: Amount must be positive.\"\n" +
            "    elif request > balance:\n" +
            "        print(\"Insufficient funds.\")\n" +
            "        result = \"Error: Not enough money.\"\n" +
            "    else:\n" +
            "        balance -= request\n" +
            "        print(f\"Dispensing ${request}...\")\n" +
            "        result = f\"Success. New balance: ${balance}\"\n" +
            "\n" +
            "    return result\n"
        );
        EXAMPLES.put("Smart Light (Loop & Condition)",
            "def smart_lighting_system(sensor_readings: list[float], threshold: float):\n" +
            "    for reading in sensor_readings:\n" +
            "        if reading < 0:\n" +
            "            print(\"Sensor Error: Negative light level.\")\n" +
            "            continue  # Skip invalid reading\n" +
            "\n" +
            "        if reading > threshold:\n" +
            "            print(f\"Bright ({reading} lux): Turning lights OFF.\")\n" +
            "            break  # Sufficient light found, stop checking\n" +
            "        else:\n" +
            "            print(f\"Dim ({reading} lux): Keep lights ON.\")\n" +
            "\n" +
            "    print(\"Lighting check complete.\")\n"
        );
        EXAMPLES.put("Server Connection (While Loop)",
            "def connect_to_server(max_retries: int):\n" +
            "    attempt = 0\n" +
            "    connected = False\n" +
            "\n" +
            "    while attempt < max_retries and not connected:\n" +
            "        print(f\"Connecting... Attempt {attempt + 1}\")\n" +
            "        # Simulate connection logic\n" +
            "        if attempt == 2:  # Pretend success on 3rd try\n" +
            "            connected = True\n" +
            "        else:\n" +
            "            attempt += 1\n" +
            "\n" +
            "    if connected:\n" +
            "        return \"Connection Established\"\n" +
            "    else:\n" +
            "        return \"Connection Failed Service Unavailable\"\n"
        );
        EXAMPLES.put("File Safer (Try/Except/Finally)",
            "def safe_file_reader(filepath: str) -> str:\n" +
            "    file_handle = None\n" +
            "    try:\n" +
            "        print(f\"Opening {filepath}...\")\n" +
            "        # Simulate opening file (would naturally raise OSError)\n" +
            "        if not filepath:\n" +
            "            raise ValueError(\"Empty filepath\")\n" +
            "        file_handle = open(filepath, 'r')\n" +
            "        data = file_handle.read()\n" +
            "        return data\n" +
            "    except FileNotFoundError:\n" +
            "        return \"Error: File not found.\"\n" +
            "    except ValueError as e:\n" +
            "        return f\"Error: Invalid input - {e}\"\n" +
            "    finally:\n" +
            "        if file_handle:\n" +
            "            print(\"Closing file handle...\")\n" +
            "            file_handle.close()\n" +
            "        print(\"Cleanup complete.\")\n"
        );
        EXAMPLES.put("Order Processing (Nested)",
            "def process_orders(orders: list[dict]):\n" +
            "    for order in orders:\n" +
            "        status = order.get(\"status\")\n" +
            "\n" +
            "        if status == \"cancelled\":\n" +
            "            continue\n" +
            "\n" +
            "        if status == \"pending\":\n" +
            "            amount = order.get(\"amount\", 0)\n" +
            "            if amount > 1000:\n" +
            "                print(\"Flagging for manual review (High Value)\")\n" +
            "            elif amount < 0:\n" +
            "                print(\"Error: Invalid Order\")\n" +
            "                break # Stop critical error\n" +
            "            else:\n" +
            "                print(\"Auto-approving order\")\n" +
            "        else:\n" +
            "            print(f\"Skipping order with status: {status}\")\n" +
            "\n" +
            "    return \"Batch Complete\"\n"
        );
    }

    private Examples() {

    }

    /**
     * Gets the names of all examples in display order.
     *
     * @return the names
     */
    public static Set<String> getNames() {
        return EXAMPLES.keySet();
    }

    /**
     * Gets the source of an example.
     *
     * @param name the example name
     * @return the source text
     * @throws IllegalArgumentException when there is no such example
     */
    public static String getSource(String name) {
        String source = EXAMPLES.get(name);
        if (source == null) {
            throw new IllegalArgumentException("Unknown example: " + name);
        }
        return source;
    }

    private static void runExample(String name, FlowchartOptions options) {
        System.out.println("===== " + name + " =====");
        System.out.println(getSource(name));
        System.out.println("--- Statement tree ---");
        System.out.println(new PythonSourceReader().read(getSource(name)));
        GraphDescription graph = Flowcharts.fromSource(getSource(name), options.toBuilder().setTitle(name).build());
        System.out.println("--- Graphviz/DOT ---");
        System.out.println(graph.toDot());
    }

    /**
     * Prints the DOT source of every example.
     *
     * @param args unused
     */
    public static void main(String[] args) {
        for (String name : getNames()) {
            runExample(name, FlowchartOptions.defaults());
        }
    }
}
